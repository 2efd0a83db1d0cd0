/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import com.google.common.util.concurrent.ListenableFuture;
import java.util.ArrayDeque;
import java.util.Deque;
import org.quarry.sql.exception.ExchangeException;
import org.quarry.sql.exception.QueryEngineException;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.port.Port;
import org.quarry.sql.planner.distributed.processor.AbstractProcessor;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.ProcessorKind;
import org.quarry.sql.planner.distributed.processor.ProcessorState;

/**
 * Sending end of an exchange. Partitions each input page, serializes the parts and sends them to
 * their receivers. A full channel puts the processor in the ASYNC state until the channel has
 * room. Once the input is finished, an END frame is sent to every receiver. Once every receiver
 * has aborted, the input is closed and the sender finishes early.
 */
public class ExchangeSinkProcessor extends AbstractProcessor {

  private final ExchangeTransport transport;
  private final int senderId;
  private final Partitioner partitioner;
  private final PageSerde serde = new PageSerde();
  private final Deque<ExchangeFrame> outbox = new ArrayDeque<>();

  private Page inputPage;
  private boolean endQueued;
  private boolean finished;

  public ExchangeSinkProcessor(
      ProcessorContext context,
      ExchangeTransport transport,
      int senderId,
      Partitioner partitioner) {
    super(context, 1, 0);
    this.transport = transport;
    this.senderId = senderId;
    this.partitioner = partitioner;
  }

  @Override
  public ProcessorKind getKind() {
    return ProcessorKind.EXCHANGE_SEND;
  }

  @Override
  public ProcessorState poll() {
    if (finished) {
      return ProcessorState.FINISHED;
    }
    if (allDestinationsAborted()) {
      outbox.clear();
      inputPage = null;
      closeInputs();
      finished = true;
      return ProcessorState.FINISHED;
    }
    if (!outbox.isEmpty()) {
      sendQueued();
      if (!outbox.isEmpty()) {
        return writable().isDone() ? ProcessorState.READY : ProcessorState.ASYNC;
      }
    }
    if (endQueued) {
      finished = true;
      return ProcessorState.FINISHED;
    }
    if (inputPage != null) {
      return ProcessorState.READY;
    }
    Port input = input(0);
    if (input.hasData()) {
      inputPage = pullFrom(input);
      input.setNeedData();
      return ProcessorState.READY;
    }
    if (input.isFinished()) {
      for (int destination = 0; destination < transport.getReceiverCount(); destination++) {
        outbox.add(ExchangeFrame.end(senderId, destination));
      }
      endQueued = true;
      return ProcessorState.READY;
    }
    input.setNeedData();
    return ProcessorState.NEED_DATA;
  }

  @Override
  public void execute() {
    if (inputPage != null) {
      Page page = inputPage;
      inputPage = null;
      Page[] parts = partitioner.partition(page);
      for (int destination = 0; destination < parts.length; destination++) {
        if (parts[destination] != null && parts[destination].getPositionCount() > 0) {
          outbox.add(
              ExchangeFrame.data(senderId, destination, serde.serialize(parts[destination])));
          getStats().recordOutput(
              parts[destination].getPositionCount(), parts[destination].getRetainedSizeBytes());
        }
      }
    }
    sendQueued();
  }

  @Override
  public ListenableFuture<?> executeAsync() {
    return writable();
  }

  private ListenableFuture<?> writable() {
    try {
      return transport.whenWritable(senderId, outbox.peek().getDestinationId());
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExchangeException(getName(), "Transport failure: " + e.getMessage(), e);
    }
  }

  private boolean allDestinationsAborted() {
    try {
      for (int destination = 0; destination < transport.getReceiverCount(); destination++) {
        if (!transport.isAborted(destination)) {
          return false;
        }
      }
      return true;
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExchangeException(getName(), "Transport failure: " + e.getMessage(), e);
    }
  }

  private void sendQueued() {
    try {
      while (!outbox.isEmpty() && transport.send(outbox.peek())) {
        outbox.poll();
      }
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExchangeException(getName(), "Transport failure: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    outbox.clear();
    inputPage = null;
    super.close();
  }
}
