/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.port.Port;

/**
 * A processor with no inputs and one output. Subclasses produce one page per {@link
 * #generate()} call and may report an outstanding external event through {@link #isBlocked()}.
 *
 * <p>A new page is only generated once the previous one has been consumed, so a source never
 * holds more than one page beyond its output port.
 */
public abstract class SourceProcessor extends AbstractProcessor {

  protected static final ListenableFuture<?> NOT_BLOCKED = Futures.immediateVoidFuture();

  private Page pending;
  private boolean finished;

  protected SourceProcessor(ProcessorContext context) {
    super(context, 0, 1);
  }

  @Override
  public ProcessorKind getKind() {
    return ProcessorKind.SOURCE;
  }

  @Override
  public ProcessorState poll() {
    if (finished) {
      return ProcessorState.FINISHED;
    }
    Port output = output(0);
    if (output.isClosed()) {
      pending = null;
      return finish();
    }
    if (pending != null) {
      if (!output.canPush()) {
        return ProcessorState.NEED_CONSUME;
      }
      pushTo(output, pending);
      pending = null;
    }
    if (isExhausted()) {
      return finish();
    }
    if (output.hasData()) {
      return ProcessorState.NEED_CONSUME;
    }
    return isBlocked().isDone() ? ProcessorState.READY : ProcessorState.ASYNC;
  }

  @Override
  public void execute() {
    pending = nonEmpty(generate());
  }

  @Override
  public ListenableFuture<?> executeAsync() {
    return isBlocked();
  }

  /** Returns the next page, or null if none is available right now. Must not block. */
  protected abstract Page generate();

  /** Returns true once {@link #generate()} will never return another page. */
  protected abstract boolean isExhausted();

  /** Returns a future completing when {@link #generate()} can make progress. */
  protected ListenableFuture<?> isBlocked() {
    return NOT_BLOCKED;
  }

  private ProcessorState finish() {
    finished = true;
    finishOutputs();
    return ProcessorState.FINISHED;
  }
}
