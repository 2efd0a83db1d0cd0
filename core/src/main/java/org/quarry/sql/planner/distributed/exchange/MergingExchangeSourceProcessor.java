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
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.port.Port;
import org.quarry.sql.planner.distributed.processor.AbstractProcessor;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.ProcessorKind;
import org.quarry.sql.planner.distributed.processor.ProcessorState;
import org.quarry.sql.planner.distributed.sort.PageComparator;
import org.quarry.sql.planner.distributed.sort.SortedPageMerger;

/**
 * Receiving end of a MERGE exchange. Each sender's stream is sorted; this receiver reads every
 * sender's channel separately and merges the streams, so the output is sorted as well. Ties go to
 * the sender with the lower id.
 */
public class MergingExchangeSourceProcessor extends AbstractProcessor {

  private final ExchangeTransport transport;
  private final int destinationId;
  private final PageSerde serde = new PageSerde();
  private final SortedPageMerger merger;
  private final byte[][] payloads;

  private Page pending;
  private int blockedOn;
  private boolean finished;

  public MergingExchangeSourceProcessor(
      ProcessorContext context,
      ExchangeTransport transport,
      int destinationId,
      PageSchema schema,
      PageComparator comparator) {
    super(context, 0, 1);
    this.transport = transport;
    this.destinationId = destinationId;
    this.merger =
        new SortedPageMerger(
            schema, comparator, transport.getSenderCount(), context.getPageSizeRows());
    this.payloads = new byte[transport.getSenderCount()][];
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
    if (output.hasData() || !output.isNeedData()) {
      return ProcessorState.NEED_CONSUME;
    }
    boolean received = false;
    int waitingOn = -1;
    for (int source = 0; source < payloads.length; source++) {
      if (payloads[source] != null) {
        received = true;
        continue;
      }
      if (!merger.needsPage(source)) {
        continue;
      }
      ExchangeFrame frame = receive(source);
      if (frame == null) {
        if (waitingOn < 0) {
          waitingOn = source;
        }
      } else if (frame.isEnd()) {
        merger.finishStream(source);
      } else {
        payloads[source] = frame.getPayload();
        received = true;
      }
    }
    if (received) {
      return ProcessorState.READY;
    }
    if (merger.isFinished()) {
      return finish();
    }
    if (waitingOn >= 0) {
      blockedOn = waitingOn;
      return readable(waitingOn).isDone() ? ProcessorState.READY : ProcessorState.ASYNC;
    }
    return ProcessorState.READY;
  }

  @Override
  public void execute() {
    boolean decoded = false;
    for (int source = 0; source < payloads.length; source++) {
      if (payloads[source] != null) {
        merger.addPage(source, decode(payloads[source]));
        payloads[source] = null;
        decoded = true;
      }
    }
    if (!decoded && merger.canMerge()) {
      pending = merger.merge();
    }
  }

  @Override
  public ListenableFuture<?> executeAsync() {
    return readable(blockedOn);
  }

  private Page decode(byte[] bytes) {
    try {
      return serde.deserialize(bytes);
    } catch (MalformedPageException e) {
      throw new ExchangeException(getName(), "Cannot decode exchange frame: " + e.getMessage(), e);
    }
  }

  private ExchangeFrame receive(int source) {
    try {
      return transport.receive(destinationId, source);
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExchangeException(getName(), "Transport failure: " + e.getMessage(), e);
    }
  }

  private ListenableFuture<?> readable(int source) {
    try {
      return transport.whenReadable(destinationId, source);
    } catch (QueryEngineException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ExchangeException(getName(), "Transport failure: " + e.getMessage(), e);
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
