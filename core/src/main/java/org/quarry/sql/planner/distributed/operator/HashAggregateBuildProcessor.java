/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import java.util.List;
import org.quarry.sql.planner.distributed.aggregation.AggregateCall;
import org.quarry.sql.planner.distributed.aggregation.AggregationTable;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.TransformProcessor;

/**
 * Partial hash aggregation. Folds raw rows into per-group intermediate state and emits it once
 * the input is finished, so a final step on another lane can combine the partial results.
 */
public class HashAggregateBuildProcessor extends TransformProcessor {

  private final AggregationTable table;

  public HashAggregateBuildProcessor(
      ProcessorContext context,
      PageSchema inputSchema,
      int[] groupChannels,
      List<AggregateCall> calls) {
    super(context);
    this.table =
        AggregationTable.partial(inputSchema, groupChannels, calls, context.getMemoryTracker());
  }

  public PageSchema getOutputSchema() {
    return table.getOutputSchema();
  }

  @Override
  protected Page process(Page page) {
    table.addPage(page);
    return null;
  }

  @Override
  protected Page flush() {
    return table.nextOutputPage(context.getPageSizeRows());
  }
}
