/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.port.Port;

/**
 * Copies every input page to all outputs, for plan nodes read by several parents. Pages are
 * immutable, so each output receives the same page instance. The next page is only taken once
 * every open output has consumed the previous one; outputs closed by their consumer are skipped.
 */
public class DuplicateProcessor extends AbstractProcessor {

  private boolean finished;

  public DuplicateProcessor(ProcessorContext context, int outputCount) {
    super(context, 1, outputCount);
  }

  @Override
  public ProcessorKind getKind() {
    return ProcessorKind.TRANSFORM;
  }

  @Override
  public ProcessorState poll() {
    if (finished) {
      return ProcessorState.FINISHED;
    }
    Port input = input(0);
    boolean anyOpen = false;
    boolean anyFull = false;
    for (int i = 0; i < outputCount(); i++) {
      Port output = output(i);
      if (!output.isClosed()) {
        anyOpen = true;
        anyFull |= output.hasData();
      }
    }
    if (!anyOpen) {
      input.close();
      return finish();
    }
    if (anyFull) {
      return ProcessorState.NEED_CONSUME;
    }
    if (input.hasData()) {
      Page page = nonEmpty(pullFrom(input));
      input.setNeedData();
      if (page == null) {
        return ProcessorState.READY;
      }
      for (int i = 0; i < outputCount(); i++) {
        if (!output(i).isClosed()) {
          pushTo(output(i), page);
        }
      }
      return ProcessorState.NEED_CONSUME;
    }
    if (input.isFinished()) {
      return finish();
    }
    input.setNeedData();
    return ProcessorState.NEED_DATA;
  }

  @Override
  public void execute() {}

  private ProcessorState finish() {
    finished = true;
    finishOutputs();
    return ProcessorState.FINISHED;
  }
}
