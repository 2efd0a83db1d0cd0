/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import com.google.common.util.concurrent.ListenableFuture;
import org.quarry.sql.exception.ExchangeException;
import org.quarry.sql.exception.MalformedPageException;
import org.quarry.sql.exception.QueryEngineException;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.port.Port;
import org.quarry.sql.planner.distributed.processor.AbstractProcessor;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.ProcessorKind;
import org.quarry.sql.planner.distributed.processor.ProcessorState;

/**
 * Receiving end of an exchange. A frame is only taken from the transport while the output port
 * asks for data, so a slow consumer leaves frames queued in the transport and eventually blocks
 * the senders. Payloads are decoded in {@link #execute()}. Finishes once every sender has sent
 * END.
 */
public class ExchangeSourceProcessor extends AbstractProcessor {

  private final ExchangeTransport transport;
  private final int destinationId;
  private final PageSerde serde = new PageSerde();
  private final boolean[] ended;

  private int endedCount;
  private byte[] payload;
  private Page pending;
  private boolean finished;

  public ExchangeSourceProcessor(
      ProcessorContext context, ExchangeTransport transport, int destinationId) {
    super(context, 0, 1);
    this.transport = transport;
    this.destinationId = destinationId;
    this.ended = new boolean[transport.getSenderCount()];
  }

  @Override
  public ProcessorKind getKind() {
    return ProcessorKind.EXCHANGE_RECEIVE;
  }

  @Override
  public ProcessorState poll() {
    if (finished) {
      return ProcessorState.FINISHED;
    }
    Port output = output(0);
    if (output.isClosed()) {
      abortTransport();
      return finish();
    }
    if (pending != null) {
      if (!output.canPush()) {
        return ProcessorState.NEED_CONSUME;
      }
      pushTo(output, pending);
      pending = null;
    }
    if (payload != null) {
      return ProcessorState.READY;
    }
    if (endedCount == ended.length) {
      return finish();
    }
    if (output.hasData() || !output.isNeedData()) {
      return ProcessorState.NEED_CONSUME;
    }
    ExchangeFrame frame = receive();
    while (frame != null && frame.isEnd()) {
      markEnded(frame.getSourceId());
      frame = receive();
    }
    if (frame != null) {
      payload = frame.getPayload();
      return ProcessorState.READY;
    }
    if (endedCount == ended.length) {
      return finish();
    }
    return readable().isDone() ? ProcessorState.READY : ProcessorState.ASYNC;
  }

  @Override
  public void execute() {
    if (payload != null) {
      byte[] bytes = payload;
      payload = null;
      pending = nonEmpty(decode(bytes));
    }
  }

  @Override
  public ListenableFuture<?> executeAsync() {
    return readable();
  }

  private ExchangeFrame receive() {
    try {
      return transport.receive(destinationId);
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExchangeException(getName(), "Transport failure: " + e.getMessage(), e);
    }
  }

  private ListenableFuture<?> readable() {
    try {
      return transport.whenReadable(destinationId);
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExchangeException(getName(), "Transport failure: " + e.getMessage(), e);
    }
  }

  private void markEnded(int source) {
    if (!ended[source]) {
      ended[source] = true;
      endedCount++;
    }
  }

  private Page decode(byte[] bytes) {
    try {
      return serde.deserialize(bytes);
    } catch (MalformedPageException e) {
      throw new ExchangeException(getName(), "Cannot decode exchange frame: " + e.getMessage(), e);
    }
  }

  private void abortTransport() {
    try {
      transport.abort(destinationId);
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExchangeException(getName(), "Transport failure: " + e.getMessage(), e);
    }
  }

  private ProcessorState finish() {
    finished = true;
    finishOutputs();
    return ProcessorState.FINISHED;
  }
}
