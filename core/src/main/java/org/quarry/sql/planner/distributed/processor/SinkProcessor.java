/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.port.Port;

/**
 * A terminal processor with one input and no outputs. Subclasses consume pages in {@link
 * #consume(Page)} and complete their work in {@link #onInputFinished()}.
 */
public abstract class SinkProcessor extends AbstractProcessor {

  private Page inputPage;
  private boolean inputFinished;
  private boolean completed;

  protected SinkProcessor(ProcessorContext context) {
    super(context, 1, 0);
  }

  @Override
  public ProcessorKind getKind() {
    return ProcessorKind.SINK;
  }

  @Override
  public ProcessorState poll() {
    if (completed) {
      return ProcessorState.FINISHED;
    }
    Port input = input(0);
    if (inputPage != null) {
      return ProcessorState.READY;
    }
    if (!inputFinished) {
      if (input.hasData()) {
        inputPage = pullFrom(input);
        input.setNeedData();
        return ProcessorState.READY;
      }
      if (!input.isFinished()) {
        input.setNeedData();
        return ProcessorState.NEED_DATA;
      }
      inputFinished = true;
    }
    return ProcessorState.READY;
  }

  @Override
  public void execute() {
    if (inputPage != null) {
      Page page = inputPage;
      inputPage = null;
      consume(page);
    } else if (inputFinished && !completed) {
      onInputFinished();
      completed = true;
    }
  }

  /** Accepts one page. */
  protected abstract void consume(Page page);

  /** Called once after the last page. */
  protected void onInputFinished() {}
}
