/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.page;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link Page} row by row. Call {@link #beginRow()}, set values via {@link #setValue(int,
 * Object)}, then {@link #endRow()} to commit. Call {@link #build()} to produce the final Page.
 */
public class PageBuilder {

  private final PageSchema schema;
  private final int channelCount;
  private final List<Object[]> rows;
  private Object[] currentRow;
  private long estimatedBytes;

  public PageBuilder(PageSchema schema) {
    this.schema = schema;
    this.channelCount = schema.size();
    this.rows = new ArrayList<>();
  }

  /** Starts a new row. Values default to null. */
  public void beginRow() {
    currentRow = new Object[channelCount];
  }

  /**
   * Sets a value in the current row.
   *
   * @param channel the column index (0-based)
   * @param value the value to set
   */
  public void setValue(int channel, Object value) {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before setValue()");
    }
    if (channel < 0 || channel >= channelCount) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + channelCount + ")");
    }
    currentRow[channel] = value;
  }

  /** Commits the current row to the page. */
  public void endRow() {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before endRow()");
    }
    for (int channel = 0; channel < channelCount; channel++) {
      Object value = currentRow[channel];
      estimatedBytes +=
          value == null ? 8 : 8 + schema.getColumn(channel).getType().estimateSize(value);
    }
    rows.add(currentRow);
    currentRow = null;
  }

  /** Appends a whole row in one call. */
  public void appendRow(Object... values) {
    if (values.length != channelCount) {
      throw new IllegalArgumentException(
          "Row has " + values.length + " values, expected " + channelCount);
    }
    beginRow();
    System.arraycopy(values, 0, currentRow, 0, channelCount);
    endRow();
  }

  /** Copies one row of a page with the same schema. */
  public void appendRow(Page page, int position) {
    beginRow();
    for (int channel = 0; channel < channelCount; channel++) {
      currentRow[channel] = page.getValue(position, channel);
    }
    endRow();
  }

  /** Returns the number of rows added so far. */
  public int getRowCount() {
    return rows.size();
  }

  /** Returns the estimated size of the rows added so far. */
  public long getEstimatedBytes() {
    return estimatedBytes;
  }

  /** Returns true if no rows have been added. */
  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public PageSchema getSchema() {
    return schema;
  }

  /** Builds the final Page from all committed rows and resets the builder. */
  public Page build() {
    if (currentRow != null) {
      throw new IllegalStateException("endRow() must be called before build()");
    }
    List<Block> blocks = new ArrayList<>(channelCount);
    for (int channel = 0; channel < channelCount; channel++) {
      Object[] values = new Object[rows.size()];
      for (int row = 0; row < values.length; row++) {
        values[row] = rows.get(row)[channel];
      }
      Column column = schema.getColumn(channel);
      blocks.add(ArrayBlock.of(column.getType(), column.isNullable(), values));
    }
    rows.clear();
    estimatedBytes = 0;
    return new ColumnarPage(schema, blocks);
  }
}
