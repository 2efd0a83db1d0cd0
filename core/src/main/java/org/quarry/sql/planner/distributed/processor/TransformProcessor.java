/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.port.Port;

/**
 * A processor with one input and one output. Subclasses turn each input page into at most one
 * output page in {@link #process(Page)}, and emit buffered results through repeated {@link
 * #flush()} calls once the input is finished.
 *
 * <p>Execution model:
 *
 * <ol>
 *   <li>Push the pending output page once the output slot is empty
 *   <li>Pull the next input page and ask upstream for more, so both sides stay busy
 *   <li>After the input finishes, call {@link #flush()} until it returns null
 *   <li>Finish the output port
 * </ol>
 */
public abstract class TransformProcessor extends AbstractProcessor {

  private Page inputPage;
  private Page outputPage;
  private boolean inputFinished;
  private boolean flushed;
  private boolean finished;

  protected TransformProcessor(ProcessorContext context) {
    super(context, 1, 1);
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
    Port output = output(0);
    if (output.isClosed()) {
      input.close();
      return finish();
    }
    if (outputPage != null) {
      if (!output.canPush()) {
        return ProcessorState.NEED_CONSUME;
      }
      pushTo(output, outputPage);
      outputPage = null;
    }
    if (!inputFinished && isDone()) {
      input.close();
      inputPage = null;
      inputFinished = true;
    }
    if (output.hasData()) {
      return ProcessorState.NEED_CONSUME;
    }
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
    if (!flushed) {
      return ProcessorState.READY;
    }
    return finish();
  }

  @Override
  public void execute() {
    if (inputPage != null) {
      Page page = inputPage;
      inputPage = null;
      outputPage = nonEmpty(process(page));
    } else if (inputFinished && !flushed) {
      Page page = flush();
      if (page == null) {
        flushed = true;
      } else {
        outputPage = nonEmpty(page);
      }
    }
  }

  /** Transforms one input page. Returns null or an empty page when there is nothing to emit. */
  protected abstract Page process(Page page);

  /**
   * Emits the next page of buffered results after the input finished, or returns null when there
   * is nothing left. Called repeatedly so each call stays bounded.
   */
  protected Page flush() {
    return null;
  }

  /** Returns true when no more input is wanted, such as a reached limit. */
  protected boolean isDone() {
    return false;
  }

  private ProcessorState finish() {
    finished = true;
    finishOutputs();
    return ProcessorState.FINISHED;
  }
}
