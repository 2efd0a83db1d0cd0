/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.SourceProcessor;
import org.quarry.sql.planner.distributed.split.PageSource;

/**
 * Reads the data units assigned to one scan lane, one {@link PageSource} after the other. A page
 * source that is waiting on storage puts the processor in the ASYNC state.
 */
@Log4j2
public class TableScanSource extends SourceProcessor {

  private final List<PageSource> pageSources;
  private int current;
  private long completedBytes;

  public TableScanSource(ProcessorContext context, List<PageSource> pageSources) {
    super(context);
    this.pageSources = ImmutableList.copyOf(pageSources);
  }

  @Override
  protected Page generate() {
    if (isExhausted()) {
      return null;
    }
    return pageSources.get(current).getNextPage();
  }

  @Override
  protected boolean isExhausted() {
    while (current < pageSources.size() && pageSources.get(current).isFinished()) {
      PageSource finished = pageSources.get(current++);
      completedBytes += finished.getCompletedBytes();
      finished.close();
    }
    return current >= pageSources.size();
  }

  @Override
  protected ListenableFuture<?> isBlocked() {
    return current < pageSources.size() ? pageSources.get(current).isBlocked() : NOT_BLOCKED;
  }

  /** Returns the bytes read by the page sources completed so far. */
  public long getCompletedBytes() {
    return completedBytes;
  }

  @Override
  public void close() {
    for (int i = current; i < pageSources.size(); i++) {
      try {
        pageSources.get(i).close();
      } catch (RuntimeException e) {
        log.warn("Error closing page source of {}", getName(), e);
      }
    }
    current = pageSources.size();
    super.close();
  }
}
