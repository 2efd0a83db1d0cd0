/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.executor;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.quarry.sql.common.setting.Settings;

/**
 * Fixed set of worker threads shared by every running pipeline, plus a single timer thread for
 * query timeouts. Pipelines never own threads: each {@link PipelineExecutor} submits short work
 * loops here and resubmits itself after {@code quantum} processor runs, so pipelines sharing the
 * pool take turns.
 */
@Log4j2
public class WorkerPool implements AutoCloseable {

  @Getter private final int threadCount;
  @Getter private final int quantum;
  private final ThreadPoolExecutor workers;
  private final ScheduledExecutorService timer;

  public WorkerPool(int threadCount, int quantum) {
    Preconditions.checkArgument(threadCount > 0, "worker thread count must be positive");
    Preconditions.checkArgument(quantum > 0, "worker quantum must be positive");
    this.threadCount = threadCount;
    this.quantum = quantum;
    this.workers =
        new ThreadPoolExecutor(
            threadCount,
            threadCount,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            new ThreadFactoryBuilder().setNameFormat("quarry-worker-%d").setDaemon(true).build());
    this.timer =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("quarry-timer-%d").setDaemon(true).build());
  }

  public static WorkerPool fromSettings(Settings settings) {
    Integer threads = settings.getSettingValue(Settings.Key.WORKER_THREADS);
    Integer quantum = settings.getSettingValue(Settings.Key.WORKER_QUANTUM);
    return new WorkerPool(threads, quantum);
  }

  /** Runs a work loop on one of the workers. */
  void execute(Runnable task) {
    workers.execute(task);
  }

  /** Runs {@code task} on the timer thread after the delay. */
  public ScheduledFuture<?> schedule(Runnable task, long delay, TimeUnit unit) {
    return timer.schedule(task, delay, unit);
  }

  public boolean isShutdown() {
    return workers.isShutdown();
  }

  @Override
  public void close() {
    timer.shutdownNow();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("Worker pool did not terminate in time, interrupting workers");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
  }
}
