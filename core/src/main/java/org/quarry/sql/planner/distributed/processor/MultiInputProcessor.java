/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import com.google.common.base.Preconditions;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.port.Port;

/**
 * A processor with several inputs and one output. Handles the output side: a pending page is
 * pushed once the slot is empty, and {@link #pollInputs()} is only consulted while the output
 * slot is empty.
 */
public abstract class MultiInputProcessor extends AbstractProcessor {

  private Page pending;
  private boolean finished;

  protected MultiInputProcessor(ProcessorContext context, int inputCount) {
    super(context, inputCount, 1);
    Preconditions.checkArgument(inputCount > 0, "%s needs at least one input", getName());
  }

  @Override
  public ProcessorKind getKind() {
    return ProcessorKind.TRANSFORM;
  }

  @Override
  public final ProcessorState poll() {
    if (finished) {
      return ProcessorState.FINISHED;
    }
    Port output = output(0);
    if (output.isClosed()) {
      pending = null;
      closeInputs();
      return finish();
    }
    if (pending != null) {
      if (!output.canPush()) {
        return ProcessorState.NEED_CONSUME;
      }
      pushTo(output, pending);
      pending = null;
    }
    if (output.hasData()) {
      return ProcessorState.NEED_CONSUME;
    }
    return pollInputs();
  }

  @Override
  public void execute() {}

  /** Moves input pages along while the output slot is empty. */
  protected abstract ProcessorState pollInputs();

  /** Queues a page for the output; it is pushed at the next poll. */
  protected void setPending(Page page) {
    Preconditions.checkState(pending == null, "%s already holds an output page", getName());
    pending = nonEmpty(page);
  }

  protected ProcessorState finish() {
    finished = true;
    finishOutputs();
    return ProcessorState.FINISHED;
  }
}
