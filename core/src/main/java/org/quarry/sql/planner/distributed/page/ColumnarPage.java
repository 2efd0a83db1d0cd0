/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.page;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.quarry.sql.exception.MalformedPageException;

/** Immutable {@link Page} made of one {@link Block} per schema column. */
public final class ColumnarPage implements Page {

  private final PageSchema schema;
  private final List<Block> blocks;
  private final int positionCount;

  /**
   * Creates a page.
   *
   * @throws MalformedPageException if the blocks disagree with the schema or with each other on
   *     the row count
   */
  public ColumnarPage(PageSchema schema, List<Block> blocks) {
    Preconditions.checkNotNull(schema, "schema");
    Preconditions.checkNotNull(blocks, "blocks");
    if (schema.size() != blocks.size()) {
      throw new MalformedPageException(
          "Schema has " + schema.size() + " columns but page has " + blocks.size() + " blocks");
    }
    int rows = blocks.isEmpty() ? 0 : blocks.get(0).getPositionCount();
    for (int i = 0; i < blocks.size(); i++) {
      Block block = blocks.get(i);
      Column column = schema.getColumn(i);
      if (block.getPositionCount() != rows) {
        throw new MalformedPageException(
            "Column "
                + column.getName()
                + " has "
                + block.getPositionCount()
                + " rows, expected "
                + rows);
      }
      if (block.getType() != column.getType()) {
        throw new MalformedPageException(
            "Column " + column.getName() + " is " + column.getType() + " but block is "
                + block.getType());
      }
      if (block.isNullable() && !column.isNullable()) {
        throw new MalformedPageException(
            "Column " + column.getName() + " is not nullable but its block is");
      }
    }
    this.schema = schema;
    this.blocks = ImmutableList.copyOf(blocks);
    this.positionCount = rows;
  }

  /** Creates a zero-column page that still carries a row count. */
  public static ColumnarPage rowCountOnly(int positionCount) {
    return new ColumnarPage(positionCount);
  }

  private ColumnarPage(int positionCount) {
    this.schema = new PageSchema(List.of());
    this.blocks = List.of();
    this.positionCount = positionCount;
  }

  @Override
  public int getPositionCount() {
    return positionCount;
  }

  @Override
  public int getChannelCount() {
    return blocks.size();
  }

  @Override
  public PageSchema getSchema() {
    return schema;
  }

  @Override
  public Block getBlock(int channel) {
    if (channel < 0 || channel >= blocks.size()) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + blocks.size() + ")");
    }
    return blocks.get(channel);
  }

  @Override
  public Page getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > positionCount) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + positionCount
              + ")");
    }
    if (positionOffset == 0 && length == positionCount) {
      return this;
    }
    if (blocks.isEmpty()) {
      return new ColumnarPage(length);
    }
    ImmutableList.Builder<Block> region = ImmutableList.builder();
    for (Block block : blocks) {
      region.add(block.getRegion(positionOffset, length));
    }
    return new ColumnarPage(schema, region.build());
  }

  @Override
  public Page selectPositions(int[] positions, int length) {
    if (blocks.isEmpty()) {
      return new ColumnarPage(length);
    }
    ImmutableList.Builder<Block> selected = ImmutableList.builder();
    for (Block block : blocks) {
      selected.add(block.copyPositions(positions, length));
    }
    return new ColumnarPage(schema, selected.build());
  }

  @Override
  public String toString() {
    return "ColumnarPage{rows=" + positionCount + ", schema=" + schema + '}';
  }
}
