/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import com.google.common.util.concurrent.ListenableFuture;
import java.util.List;
import org.quarry.sql.planner.distributed.port.Port;

/**
 * A stateful node of the pipeline graph, connected to its peers through single-slot {@link
 * Port}s.
 *
 * <p>Lifecycle:
 *
 * <ol>
 *   <li>The scheduler calls {@link #poll()}. The processor inspects its ports, may move pages
 *       between its ports and its own buffers, and reports its state without doing real work
 *   <li>On {@link ProcessorState#READY} the scheduler calls {@link #execute()}, one bounded unit of
 *       non-blocking work, then polls again
 *   <li>On {@link ProcessorState#ASYNC} the scheduler calls {@link #executeAsync()} and polls again
 *       once the returned future completes
 *   <li>On {@link ProcessorState#FINISHED} the processor is never called again except {@link
 *       #close()}
 * </ol>
 *
 * <p>The scheduler guarantees that at most one thread calls into a processor at any instant, so
 * implementations need no locking on their own state.
 */
public interface Processor extends AutoCloseable {

  /** Returns the unique name of this processor within its pipeline. */
  String getName();

  /** Returns the role of this processor. */
  ProcessorKind getKind();

  /** Returns the runtime context of this processor. */
  ProcessorContext getContext();

  /** Returns the input ports, in declaration order. Unattached slots are null. */
  List<Port> getInputPorts();

  /** Returns the output ports, in declaration order. Unattached slots are null. */
  List<Port> getOutputPorts();

  /** Attaches the port feeding input {@code index}. */
  void attachInput(int index, Port port);

  /** Attaches the port fed by output {@code index}. */
  void attachOutput(int index, Port port);

  /** Inspects the ports and returns the current state. */
  ProcessorState poll();

  /** Performs one bounded unit of synchronous work. Must not block. */
  void execute();

  /**
   * Starts waiting on exactly one external event. The processor is polled again when the returned
   * future completes; a failed future fails the processor.
   */
  ListenableFuture<?> executeAsync();

  /** Returns the rows, bytes and pages this processor has moved so far. */
  ProcessorStats getStats();

  /** Releases resources. Called once, after the processor reached a terminal state. */
  @Override
  void close();
}
