/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.page;

/**
 * A column of data within a {@link Page}. Each Block holds values for a single column across all
 * rows in the page. Blocks are immutable once built and may be shared by any number of pages and
 * processors.
 */
public interface Block {

  /** Returns the number of values (rows) in this block. */
  int getPositionCount();

  /**
   * Returns the value at the given position.
   *
   * @param position the row index (0-based)
   * @return the value, or null if the position is null
   */
  Object getValue(int position);

  /**
   * Returns true if the value at the given position is null.
   *
   * @param position the row index (0-based)
   * @return true if null
   */
  boolean isNull(int position);

  /** Returns true if this block may hold nulls. */
  boolean isNullable();

  /** Returns the estimated memory retained by this block in bytes. */
  long getRetainedSizeBytes();

  /**
   * Returns a sub-region of this block.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Block representing the sub-region
   */
  Block getRegion(int positionOffset, int length);

  /**
   * Returns a block holding the values at the given positions, in the given order.
   *
   * @param positions row indexes into this block
   * @return a new Block
   */
  Block copyPositions(int[] positions, int length);

  /** Returns the data type of this block's values. */
  BlockType getType();

  /**
   * Supported block data types. TIMESTAMP values are epoch milliseconds held as {@link Long}, DATE
   * values are epoch days held as {@link Integer}.
   */
  enum BlockType {
    BOOLEAN(Boolean.class, 1),
    INT(Integer.class, 4),
    LONG(Long.class, 8),
    FLOAT(Float.class, 4),
    DOUBLE(Double.class, 8),
    STRING(String.class, 16),
    BYTES(byte[].class, 16),
    TIMESTAMP(Long.class, 8),
    DATE(Integer.class, 4);

    private final Class<?> javaType;
    private final int estimatedWidth;

    BlockType(Class<?> javaType, int estimatedWidth) {
      this.javaType = javaType;
      this.estimatedWidth = estimatedWidth;
    }

    /** Returns the Java class every non-null value of this type is an instance of. */
    public Class<?> getJavaType() {
      return javaType;
    }

    /** Returns true if the value is null or an instance of this type's Java class. */
    public boolean accepts(Object value) {
      return value == null || javaType.isInstance(value);
    }

    /** Returns true for the numeric types arithmetic and SUM/AVG apply to. */
    public boolean isNumeric() {
      return this == INT || this == LONG || this == FLOAT || this == DOUBLE;
    }

    /** Returns the estimated size of one value in bytes. */
    public long estimateSize(Object value) {
      if (value instanceof String) {
        return 16L + 2L * ((String) value).length();
      }
      if (value instanceof byte[]) {
        return 16L + ((byte[]) value).length;
      }
      return estimatedWidth;
    }
  }
}
