/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import com.google.common.base.Preconditions;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.TransformProcessor;

/**
 * Processor that limits the number of rows passing through the pipeline, after skipping an
 * offset. Truncates pages when the accumulated row count reaches the limit, then closes its input
 * so upstream stops producing.
 */
public class LimitProcessor extends TransformProcessor {

  private final long limit;
  private final long offset;

  private long skippedRows;
  private long accumulatedRows;

  public LimitProcessor(ProcessorContext context, long limit, long offset) {
    super(context);
    Preconditions.checkArgument(limit >= 0, "limit must not be negative: %s", limit);
    Preconditions.checkArgument(offset >= 0, "offset must not be negative: %s", offset);
    this.limit = limit;
    this.offset = offset;
  }

  @Override
  protected Page process(Page page) {
    if (accumulatedRows >= limit) {
      return null;
    }
    int start = 0;
    int pageRows = page.getPositionCount();
    if (skippedRows < offset) {
      start = (int) Math.min(offset - skippedRows, pageRows);
      skippedRows += start;
    }
    int available = pageRows - start;
    if (available == 0) {
      return null;
    }
    int taken = (int) Math.min(available, limit - accumulatedRows);
    accumulatedRows += taken;
    if (start == 0 && taken == pageRows) {
      // Entire page fits within limit
      return page;
    }
    return page.getRegion(start, taken);
  }

  @Override
  protected boolean isDone() {
    return accumulatedRows >= limit;
  }
}
