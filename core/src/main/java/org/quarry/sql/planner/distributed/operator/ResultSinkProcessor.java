/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.SinkProcessor;

/** Terminal processor handing the query result to a {@link ResultCollector}. */
public class ResultSinkProcessor extends SinkProcessor {

  private final ResultCollector collector;

  public ResultSinkProcessor(ProcessorContext context, ResultCollector collector) {
    super(context);
    this.collector = collector;
  }

  @Override
  protected void consume(Page page) {
    collector.addPage(page);
  }

  public ResultCollector getCollector() {
    return collector;
  }
}
