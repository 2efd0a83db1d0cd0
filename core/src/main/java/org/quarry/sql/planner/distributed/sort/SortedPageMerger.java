/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.sort;

import com.google.common.base.Preconditions;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageBuilder;
import org.quarry.sql.planner.distributed.page.PageSchema;

/**
 * K-way merge of sorted page streams. Each stream is fed one page at a time; a row can only be
 * emitted while every unfinished stream has a current page, since any of them may hold the next
 * smallest row. Ties go to the stream with the lower index, which keeps the output order
 * deterministic.
 */
public class SortedPageMerger {

  private final PageSchema schema;
  private final PageComparator comparator;
  private final int pageSizeRows;
  private final Page[] pages;
  private final int[] positions;
  private final boolean[] finished;

  public SortedPageMerger(
      PageSchema schema, PageComparator comparator, int streamCount, int pageSizeRows) {
    Preconditions.checkArgument(streamCount > 0, "merge needs at least one stream");
    this.schema = schema;
    this.comparator = comparator;
    this.pageSizeRows = pageSizeRows;
    this.pages = new Page[streamCount];
    this.positions = new int[streamCount];
    this.finished = new boolean[streamCount];
  }

  public int getStreamCount() {
    return pages.length;
  }

  /** Returns true if the stream is unfinished and its current page is used up. */
  public boolean needsPage(int stream) {
    return !finished[stream] && !hasRows(stream);
  }

  public void addPage(int stream, Page page) {
    Preconditions.checkState(needsPage(stream), "stream %s still holds rows", stream);
    pages[stream] = page;
    positions[stream] = 0;
  }

  /** Marks the stream as having no more pages. */
  public void finishStream(int stream) {
    finished[stream] = true;
  }

  /** Returns true if rows can be emitted right now. */
  public boolean canMerge() {
    boolean anyRows = false;
    for (int stream = 0; stream < pages.length; stream++) {
      if (needsPage(stream)) {
        return false;
      }
      anyRows |= hasRows(stream);
    }
    return anyRows;
  }

  /** Returns true once every stream is finished and drained. */
  public boolean isFinished() {
    for (int stream = 0; stream < pages.length; stream++) {
      if (!finished[stream] || hasRows(stream)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Emits up to one page of merged rows, stopping early when some stream needs its next page.
   * Returns null if nothing could be emitted.
   */
  public Page merge() {
    PageBuilder builder = new PageBuilder(schema);
    while (builder.getRowCount() < pageSizeRows && canMerge()) {
      int next = -1;
      for (int stream = 0; stream < pages.length; stream++) {
        if (!hasRows(stream)) {
          continue;
        }
        if (next < 0
            || comparator.compare(pages[stream], positions[stream], pages[next], positions[next])
                < 0) {
          next = stream;
        }
      }
      builder.appendRow(pages[next], positions[next]);
      if (++positions[next] == pages[next].getPositionCount()) {
        pages[next] = null;
      }
    }
    return builder.isEmpty() ? null : builder.build();
  }

  private boolean hasRows(int stream) {
    return pages[stream] != null && positions[stream] < pages[stream].getPositionCount();
  }
}
