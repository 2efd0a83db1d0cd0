/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.page;

/**
 * An immutable columnar batch of rows, the unit of transfer between processors. All blocks of a
 * page share the same row count.
 */
public interface Page {

  /** Returns the number of rows in this page. */
  int getPositionCount();

  /** Returns the number of columns in this page. */
  int getChannelCount();

  /** Returns the names, types and nullability of the columns. */
  PageSchema getSchema();

  /**
   * Returns the columnar block for the given channel.
   *
   * @param channel the column index (0-based)
   * @return the block for the channel
   */
  Block getBlock(int channel);

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  default Object getValue(int position, int channel) {
    return getBlock(channel).getValue(position);
  }

  /**
   * Returns a sub-region of this page.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Page representing the sub-region
   */
  Page getRegion(int positionOffset, int length);

  /**
   * Returns a page holding the first {@code length} rows listed in {@code positions}.
   *
   * @param positions row indexes into this page
   * @param length how many entries of {@code positions} to use
   */
  Page selectPositions(int[] positions, int length);

  /** Returns the estimated memory retained by this page in bytes. */
  default long getRetainedSizeBytes() {
    long size = 0;
    for (int channel = 0; channel < getChannelCount(); channel++) {
      size += getBlock(channel).getRetainedSizeBytes();
    }
    return size;
  }

  /** Returns an empty page with zero rows and the given schema. */
  static Page empty(PageSchema schema) {
    return new PageBuilder(schema).build();
  }
}
