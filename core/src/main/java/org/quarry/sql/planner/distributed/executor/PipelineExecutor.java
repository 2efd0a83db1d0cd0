/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.executor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.quarry.sql.exception.ProcessorException;
import org.quarry.sql.exception.QueryCancelledException;
import org.quarry.sql.exception.QueryEngineException;
import org.quarry.sql.planner.distributed.pipeline.Pipeline;
import org.quarry.sql.planner.distributed.pipeline.PipelineContext;
import org.quarry.sql.planner.distributed.port.Port;
import org.quarry.sql.planner.distributed.processor.Processor;
import org.quarry.sql.planner.distributed.processor.ProcessorKind;
import org.quarry.sql.planner.distributed.processor.ProcessorState;
import org.quarry.sql.planner.distributed.processor.ProcessorStats;

/**
 * Runs one validated {@link Pipeline} to completion on a shared {@link WorkerPool}.
 *
 * <p>Processors are scheduled on demand. A processor is queued when it starts, when a peer
 * touches one of its ports, or when the future it waits on completes. A worker takes a
 * processor, polls it, executes one unit of work if it is ready, polls again and then wakes the
 * peers whose ports it touched. At most {@code concurrency} workers serve this pipeline at a time,
 * and a processor is held by at most one of them.
 *
 * <p>The first failure fails the pipeline. Among failures raised before cancellation was
 * observed, the one from the processor with the lowest topological id is reported. Every
 * processor then terminates at its next scheduling point, and all processors are closed exactly
 * once before the completion future resolves.
 */
@Log4j2
public class PipelineExecutor {

  private final Pipeline pipeline;
  private final PipelineContext context;
  private final WorkerPool workerPool;
  private final int concurrency;
  private final int quantum;

  private final List<ExecutorNode> nodes;
  private final Map<Processor, ExecutorNode> nodeByProcessor = new IdentityHashMap<>();

  private final ConcurrentLinkedQueue<ExecutorNode> runQueue = new ConcurrentLinkedQueue<>();
  private final AtomicInteger activeWorkers = new AtomicInteger();
  private final AtomicInteger pendingAsync = new AtomicInteger();
  private final AtomicInteger remaining = new AtomicInteger();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean completed = new AtomicBoolean();
  private final SettableFuture<ExecutionStats> completion = SettableFuture.create();

  private final Object failureLock = new Object();
  private RuntimeException terminalError;
  private int terminalErrorNodeId;

  private volatile long startNanos;

  public PipelineExecutor(Pipeline pipeline, WorkerPool workerPool) {
    this(pipeline, workerPool, workerPool.getThreadCount());
  }

  public PipelineExecutor(Pipeline pipeline, WorkerPool workerPool, int concurrency) {
    Preconditions.checkArgument(concurrency > 0, "concurrency must be positive");
    this.pipeline = Preconditions.checkNotNull(pipeline, "pipeline");
    this.context = pipeline.getContext();
    this.workerPool = Preconditions.checkNotNull(workerPool, "workerPool");
    this.concurrency = concurrency;
    this.quantum = workerPool.getQuantum();
    if (!pipeline.isValidated()) {
      pipeline.validate();
    }
    ImmutableList.Builder<ExecutorNode> builder = ImmutableList.builder();
    for (Processor processor : pipeline.getProcessors()) {
      ExecutorNode node = new ExecutorNode(pipeline.getProcessorId(processor), processor);
      builder.add(node);
      nodeByProcessor.put(processor, node);
    }
    this.nodes = builder.build();
    this.remaining.set(nodes.size());
  }

  public Pipeline getPipeline() {
    return pipeline;
  }

  /**
   * Starts execution and returns a future resolving with the run statistics, or failing with the
   * terminal error. May be called once.
   */
  public ListenableFuture<ExecutionStats> start() {
    Preconditions.checkState(
        started.compareAndSet(false, true), "Pipeline %s already started", context.getPipelineId());
    startNanos = System.nanoTime();
    context.setRunning();
    log.debug(
        "Starting pipeline {} with {} processors and {} ports",
        context.getPipelineId(),
        nodes.size(),
        pipeline.getPorts().size());
    if (nodes.isEmpty()) {
      complete();
      return completion;
    }
    for (ExecutorNode node : nodes) {
      if (node.scheduled.compareAndSet(false, true)) {
        runQueue.add(node);
      }
    }
    trySpawnWorker();
    return completion;
  }

  /** Starts execution and blocks until it is done, rethrowing the terminal error. */
  public ExecutionStats run() {
    ListenableFuture<ExecutionStats> future = start();
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel(QueryCancelledException.Reason.USER);
      throw new QueryCancelledException(QueryCancelledException.Reason.USER);
    } catch (ExecutionException e) {
      throw unwrap(e.getCause());
    }
  }

  /** Requests cancellation by the user. */
  public void cancel() {
    cancel(QueryCancelledException.Reason.USER);
  }

  /**
   * Requests cancellation. Idempotent; safe from any thread. Running processors finish their
   * current unit of work and then terminate.
   */
  public void cancel(QueryCancelledException.Reason reason) {
    if (completed.get()) {
      return;
    }
    synchronized (failureLock) {
      if (terminalError == null) {
        terminalError = new QueryCancelledException(reason);
        terminalErrorNodeId = -1;
      }
    }
    if (context.requestCancel(reason)) {
      log.debug("Cancelling pipeline {}: {}", context.getPipelineId(), reason);
      stopAll();
    }
  }

  public boolean isDone() {
    return completion.isDone();
  }

  static RuntimeException unwrap(Throwable cause) {
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    if (cause instanceof Error) {
      throw (Error) cause;
    }
    return new QueryEngineException("Pipeline execution failed", cause);
  }

  // ---- worker side ----

  private void trySpawnWorker() {
    while (true) {
      int active = activeWorkers.get();
      if (active >= concurrency || runQueue.isEmpty()) {
        return;
      }
      if (activeWorkers.compareAndSet(active, active + 1)) {
        try {
          workerPool.execute(this::workLoop);
        } catch (RejectedExecutionException e) {
          activeWorkers.decrementAndGet();
          log.error("Worker pool rejected pipeline {}", context.getPipelineId(), e);
          abandon(new QueryEngineException("Worker pool is shut down", e));
          return;
        }
      }
    }
  }

  private void workLoop() {
    try {
      int processed = 0;
      ExecutorNode node;
      while (processed < quantum && (node = runQueue.poll()) != null) {
        process(node);
        processed++;
      }
    } finally {
      activeWorkers.decrementAndGet();
      if (!runQueue.isEmpty()) {
        trySpawnWorker();
      } else {
        checkStall();
      }
    }
  }

  private void process(ExecutorNode node) {
    long begin = System.nanoTime();
    node.dirty = false;
    boolean cancelledAtStart = context.isCancelled();
    ProcessorState state;
    try {
      state = step(node);
    } catch (Throwable t) {
      state = fail(node, t, cancelledAtStart);
    }
    node.processNanos += System.nanoTime() - begin;
    wakePeers(node);
    reschedule(node, state);
  }

  private ProcessorState step(ExecutorNode node) {
    if (context.isCancelled()) {
      return terminate(node);
    }
    Throwable asyncFailure = node.asyncFailure;
    if (asyncFailure != null) {
      node.asyncFailure = null;
      throw unwrap(asyncFailure);
    }
    Processor processor = node.processor;
    ProcessorState state = processor.poll();
    if (state == ProcessorState.READY) {
      if (context.isCancelled()) {
        return terminate(node);
      }
      long begin = System.nanoTime();
      try {
        processor.execute();
      } finally {
        node.executeCount++;
        node.executeNanos += System.nanoTime() - begin;
      }
      state = processor.poll();
    }
    if (state == ProcessorState.FAILED) {
      throw new ProcessorException(processor.getName(), "processor reported failure");
    }
    return state;
  }

  /** Ends a node without asking the processor: finish what it produces, close what it reads. */
  private ProcessorState terminate(ExecutorNode node) {
    for (Port port : node.processor.getOutputPorts()) {
      port.finish();
    }
    for (Port port : node.processor.getInputPorts()) {
      port.close();
    }
    return ProcessorState.FINISHED;
  }

  private ProcessorState fail(ExecutorNode node, Throwable cause, boolean cancelledAtStart) {
    RuntimeException error =
        cause instanceof QueryEngineException
            ? (RuntimeException) cause
            : new ProcessorException(
                node.processor.getName(), String.valueOf(cause.getMessage()), cause);
    for (Port port : node.processor.getOutputPorts()) {
      port.fail(error);
    }
    for (Port port : node.processor.getInputPorts()) {
      port.close();
    }
    recordFailure(node, error, cancelledAtStart);
    return ProcessorState.FAILED;
  }

  private void recordFailure(ExecutorNode node, RuntimeException error, boolean cancelledAtStart) {
    synchronized (failureLock) {
      if (terminalError == null) {
        terminalError = error;
        terminalErrorNodeId = node.id;
      } else if (!cancelledAtStart
          && !(terminalError instanceof QueryCancelledException)
          && node.id < terminalErrorNodeId) {
        log.warn(
            "Pipeline {}: superseding failure of processor id {}",
            context.getPipelineId(),
            terminalErrorNodeId,
            terminalError);
        terminalError = error;
        terminalErrorNodeId = node.id;
      } else {
        log.warn(
            "Pipeline {}: processor {} failed after the pipeline had already failed",
            context.getPipelineId(),
            node.processor.getName(),
            error);
      }
    }
    if (context.requestCancel(null)) {
      log.debug("Pipeline {} failed in {}", context.getPipelineId(), node.processor.getName());
      stopAll();
    }
  }

  private void wakePeers(ExecutorNode node) {
    for (Port port : node.processor.getOutputPorts()) {
      if (port.takeConsumerSignal()) {
        wake(nodeByProcessor.get(port.getConsumer()));
      }
    }
    for (Port port : node.processor.getInputPorts()) {
      if (port.takeProducerSignal()) {
        wake(nodeByProcessor.get(port.getProducer()));
      }
    }
  }

  private void wake(ExecutorNode node) {
    node.dirty = true;
    if (node.scheduled.compareAndSet(false, true)) {
      enqueue(node);
    }
  }

  private void enqueue(ExecutorNode node) {
    runQueue.add(node);
    trySpawnWorker();
  }

  private void reschedule(ExecutorNode node, ProcessorState state) {
    switch (state) {
      case READY:
        enqueue(node);
        break;
      case ASYNC:
        waitAsync(node);
        break;
      case FINISHED:
      case FAILED:
        node.terminal = true;
        if (remaining.decrementAndGet() == 0) {
          complete();
        }
        break;
      default:
        node.scheduled.set(false);
        if (node.dirty && node.scheduled.compareAndSet(false, true)) {
          enqueue(node);
        }
    }
  }

  private void waitAsync(ExecutorNode node) {
    ListenableFuture<?> future;
    try {
      future = node.processor.executeAsync();
    } catch (Throwable t) {
      ProcessorState state = fail(node, t, context.isCancelled());
      wakePeers(node);
      reschedule(node, state);
      return;
    }
    // The processor keeps its own future; cancelling ours must not reach it.
    ListenableFuture<?> guarded = Futures.nonCancellationPropagating(future);
    node.pendingFuture = guarded;
    pendingAsync.incrementAndGet();
    Futures.addCallback(
        guarded,
        new FutureCallback<Object>() {
          @Override
          public void onSuccess(Object result) {
            resume(node, null);
          }

          @Override
          public void onFailure(Throwable t) {
            resume(node, t instanceof CancellationException ? null : t);
          }
        },
        MoreExecutors.directExecutor());
    if (context.isCancelled()) {
      guarded.cancel(false);
    }
  }

  private void resume(ExecutorNode node, Throwable failure) {
    node.pendingFuture = null;
    if (failure != null) {
      node.asyncFailure = failure;
    }
    enqueue(node);
    pendingAsync.decrementAndGet();
  }

  private void stopAll() {
    if (!started.get()) {
      return;
    }
    for (ExecutorNode node : nodes) {
      wake(node);
      ListenableFuture<?> future = node.pendingFuture;
      if (future != null) {
        future.cancel(false);
      }
    }
  }

  private void checkStall() {
    if (completed.get()) {
      return;
    }
    if (pendingAsync.get() == 0
        && runQueue.isEmpty()
        && activeWorkers.get() == 0
        && remaining.get() > 0) {
      String waiting =
          nodes.stream()
              .filter(node -> !node.terminal)
              .map(node -> node.processor.getName())
              .collect(Collectors.joining(", "));
      log.error("Pipeline {} stalled, waiting processors: {}", context.getPipelineId(), waiting);
      abandon(new QueryEngineException("Pipeline stalled with unfinished processors: " + waiting));
    }
  }

  /** Fails the run from outside any processor. */
  private void abandon(RuntimeException error) {
    synchronized (failureLock) {
      if (terminalError == null || terminalError instanceof QueryCancelledException) {
        terminalError = error;
        terminalErrorNodeId = -1;
      }
    }
    context.requestCancel(null);
    if (workerPool.isShutdown()) {
      complete();
    } else {
      stopAll();
    }
  }

  private void complete() {
    if (!completed.compareAndSet(false, true)) {
      return;
    }
    for (ExecutorNode node : nodes) {
      try {
        node.processor.close();
      } catch (RuntimeException e) {
        log.warn("Error closing processor {}", node.processor.getName(), e);
      }
    }
    ExecutionStats stats = buildStats();
    RuntimeException error;
    synchronized (failureLock) {
      error = terminalError;
    }
    if (error == null) {
      context.setFinished();
      log.debug(
          "Pipeline {} finished in {} ms",
          context.getPipelineId(),
          stats.getElapsedNanos() / 1_000_000);
      completion.set(stats);
    } else if (error instanceof QueryCancelledException) {
      context.setCancelled();
      completion.setException(error);
    } else {
      context.setFailed(error.getMessage());
      completion.setException(error);
    }
  }

  private ExecutionStats buildStats() {
    long processedRows = 0;
    long processedBytes = 0;
    long resultRows = 0;
    long executeCount = 0;
    long schedulingNanos = 0;
    ImmutableList.Builder<ExecutionStats.ProcessorSummary> summaries = ImmutableList.builder();
    for (ExecutorNode node : nodes) {
      Processor processor = node.processor;
      ProcessorStats stats = processor.getStats();
      ProcessorKind kind = processor.getKind();
      if (kind == ProcessorKind.SOURCE || kind == ProcessorKind.EXCHANGE_RECEIVE) {
        processedRows += stats.getOutputRows();
        processedBytes += stats.getOutputBytes();
      } else if (kind == ProcessorKind.SINK) {
        resultRows += stats.getInputRows();
      }
      executeCount += node.executeCount;
      schedulingNanos += Math.max(0, node.processNanos - node.executeNanos);
      summaries.add(
          new ExecutionStats.ProcessorSummary(
              processor.getName(),
              kind,
              stats.getInputRows(),
              stats.getOutputRows(),
              stats.getOutputBytes(),
              node.executeCount,
              node.executeNanos));
    }
    long elapsed = startNanos == 0 ? 0 : System.nanoTime() - startNanos;
    return new ExecutionStats(
        processedRows,
        processedBytes,
        resultRows,
        executeCount,
        schedulingNanos,
        elapsed,
        summaries.build());
  }
}
