/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.port.Port;
import org.quarry.sql.planner.distributed.sort.PageComparator;
import org.quarry.sql.planner.distributed.sort.SortedPageMerger;

/** Merges inputs that are each sorted by the same keys into one sorted output. */
public class SortedMergeProcessor extends MultiInputProcessor {

  private final SortedPageMerger merger;

  public SortedMergeProcessor(
      ProcessorContext context, int inputCount, PageSchema schema, PageComparator comparator) {
    super(context, inputCount);
    this.merger =
        new SortedPageMerger(schema, comparator, inputCount, context.getPageSizeRows());
  }

  @Override
  protected ProcessorState pollInputs() {
    boolean waiting = false;
    for (int stream = 0; stream < inputCount(); stream++) {
      Port port = input(stream);
      while (merger.needsPage(stream) && port.hasData()) {
        merger.addPage(stream, pullFrom(port));
      }
      if (merger.needsPage(stream)) {
        if (port.isFinished()) {
          merger.finishStream(stream);
        } else {
          port.setNeedData();
          waiting = true;
        }
      } else {
        port.setNeedData();
      }
    }
    if (merger.isFinished()) {
      return finish();
    }
    return waiting ? ProcessorState.NEED_DATA : ProcessorState.READY;
  }

  @Override
  public void execute() {
    setPending(merger.merge());
  }
}
