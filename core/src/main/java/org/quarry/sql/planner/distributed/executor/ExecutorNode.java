/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.executor;

import com.google.common.util.concurrent.ListenableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.quarry.sql.planner.distributed.processor.Processor;

/**
 * Scheduler bookkeeping for one processor.
 *
 * <p>{@code scheduled} is true while the node sits in the run queue, is being processed, or waits
 * on an async future. A wake-up arriving in any of those phases only raises {@code dirty}; the
 * worker re-checks it when it hands the node back. A terminal node keeps {@code scheduled} set
 * forever so it is never queued again.
 */
final class ExecutorNode {

  final int id;
  final Processor processor;
  final AtomicBoolean scheduled = new AtomicBoolean();
  volatile boolean dirty;

  volatile ListenableFuture<?> pendingFuture;
  volatile Throwable asyncFailure;

  // Written only by the worker that holds the node.
  boolean terminal;
  long executeCount;
  long executeNanos;
  long processNanos;

  ExecutorNode(int id, Processor processor) {
    this.id = id;
    this.processor = processor;
  }

  @Override
  public String toString() {
    return processor.getName() + "(" + id + ")";
  }
}
