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
 * Final hash aggregation. Combines the intermediate state emitted by {@link
 * HashAggregateBuildProcessor}s and emits one row per group with the final values.
 */
public class HashAggregateFinalizeProcessor extends TransformProcessor {

  private final AggregationTable table;

  public HashAggregateFinalizeProcessor(
      ProcessorContext context,
      PageSchema intermediateSchema,
      int groupCount,
      List<AggregateCall> calls) {
    super(context);
    this.table =
        AggregationTable.finalStep(
            intermediateSchema, groupCount, calls, context.getMemoryTracker());
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
