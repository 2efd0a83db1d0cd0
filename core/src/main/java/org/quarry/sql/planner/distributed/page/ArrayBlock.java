/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.page;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import org.quarry.sql.exception.MalformedPageException;

/**
 * Immutable array-backed {@link Block}. Construction checks that every value matches the declared
 * type and that a non-nullable block holds no nulls.
 */
public final class ArrayBlock implements Block {

  private final BlockType type;
  private final boolean nullable;
  private final Object[] values;
  private long retainedSizeBytes = -1;

  private ArrayBlock(BlockType type, boolean nullable, Object[] values) {
    this.type = type;
    this.nullable = nullable;
    this.values = values;
  }

  /**
   * Creates a block, validating the values. The array is owned by the block afterwards.
   *
   * @throws MalformedPageException if a value does not match the type or nullability
   */
  public static ArrayBlock of(BlockType type, boolean nullable, Object... values) {
    Preconditions.checkNotNull(type, "type");
    Preconditions.checkNotNull(values, "values");
    for (int i = 0; i < values.length; i++) {
      Object value = values[i];
      if (value == null) {
        if (!nullable) {
          throw new MalformedPageException(
              "Null at position " + i + " of non-nullable " + type + " block");
        }
      } else if (!type.accepts(value)) {
        throw new MalformedPageException(
            "Value of "
                + value.getClass().getSimpleName()
                + " at position "
                + i
                + " does not match block type "
                + type);
      }
    }
    return new ArrayBlock(type, nullable, values);
  }

  @Override
  public int getPositionCount() {
    return values.length;
  }

  @Override
  public Object getValue(int position) {
    checkPosition(position);
    return values[position];
  }

  @Override
  public boolean isNull(int position) {
    checkPosition(position);
    return values[position] == null;
  }

  @Override
  public boolean isNullable() {
    return nullable;
  }

  @Override
  public long getRetainedSizeBytes() {
    if (retainedSizeBytes < 0) {
      long size = 16L + 8L * values.length;
      for (Object value : values) {
        if (value != null) {
          size += type.estimateSize(value);
        }
      }
      retainedSizeBytes = size;
    }
    return retainedSizeBytes;
  }

  @Override
  public Block getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > values.length) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + values.length
              + ")");
    }
    if (positionOffset == 0 && length == values.length) {
      return this;
    }
    return new ArrayBlock(
        type, nullable, Arrays.copyOfRange(values, positionOffset, positionOffset + length));
  }

  @Override
  public Block copyPositions(int[] positions, int length) {
    Object[] copy = new Object[length];
    for (int i = 0; i < length; i++) {
      copy[i] = getValue(positions[i]);
    }
    return new ArrayBlock(type, nullable, copy);
  }

  @Override
  public BlockType getType() {
    return type;
  }

  private void checkPosition(int position) {
    if (position < 0 || position >= values.length) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + values.length + ")");
    }
  }

  @Override
  public String toString() {
    return "ArrayBlock{type=" + type + ", positions=" + values.length + '}';
  }
}
