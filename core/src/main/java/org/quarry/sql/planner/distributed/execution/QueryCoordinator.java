/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.execution;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.quarry.sql.common.response.ResponseListener;
import org.quarry.sql.common.setting.Settings;
import org.quarry.sql.exception.ExchangeException;
import org.quarry.sql.exception.QueryCancelledException;
import org.quarry.sql.exception.QueryEngineException;
import org.quarry.sql.planner.distributed.exchange.ExchangeManager;
import org.quarry.sql.planner.distributed.executor.ExecutionStats;
import org.quarry.sql.planner.distributed.executor.PipelineExecutor;
import org.quarry.sql.planner.distributed.executor.WorkerPool;
import org.quarry.sql.planner.distributed.operator.ResultCollector;
import org.quarry.sql.planner.distributed.pipeline.Pipeline;
import org.quarry.sql.planner.distributed.pipeline.PipelineBuilder;
import org.quarry.sql.planner.physical.PhysicalPlan;

/**
 * Entry point for running physical plans. Builds a pipeline per query, runs it on the shared
 * worker pool, enforces the query timeout and resubmits a fresh pipeline after exchange failures
 * while retries remain.
 */
@Log4j2
public class QueryCoordinator {

  private final PipelineBuilder pipelineBuilder;
  private final ExchangeManager exchangeManager;
  private final WorkerPool workerPool;
  private final long timeoutMillis;
  private final int maxRetries;

  public QueryCoordinator(
      Settings settings,
      PipelineBuilder pipelineBuilder,
      ExchangeManager exchangeManager,
      WorkerPool workerPool) {
    this.pipelineBuilder = Preconditions.checkNotNull(pipelineBuilder, "pipelineBuilder");
    this.exchangeManager = Preconditions.checkNotNull(exchangeManager, "exchangeManager");
    this.workerPool = Preconditions.checkNotNull(workerPool, "workerPool");
    Long timeout = settings.getSettingValue(Settings.Key.QUERY_TIMEOUT_MILLIS);
    Integer retries = settings.getSettingValue(Settings.Key.QUERY_MAX_RETRIES);
    this.timeoutMillis = timeout;
    this.maxRetries = retries;
  }

  /**
   * Builds the pipeline of {@code plan} and starts it.
   *
   * @throws org.quarry.sql.exception.PipelineConstructionException if the plan is invalid
   */
  public QueryExecution submit(PhysicalPlan plan) {
    String queryId = UUID.randomUUID().toString();
    RunningQuery query = new RunningQuery(queryId, plan);
    log.info("Submitting query {}", queryId);
    Pipeline pipeline = pipelineBuilder.build(plan, pipelineId(queryId, 1));
    query.start(pipeline);
    return query;
  }

  /**
   * Submits {@code plan} and reports the outcome to {@code listener}. Construction errors are
   * reported to the listener as well.
   */
  public void submit(PhysicalPlan plan, ResponseListener<QuerySummary> listener) {
    RunningQuery query;
    try {
      query = (RunningQuery) submit(plan);
    } catch (QueryEngineException e) {
      listener.onFailure(e);
      return;
    }
    Futures.addCallback(
        query.completion,
        new FutureCallback<QuerySummary>() {
          @Override
          public void onSuccess(QuerySummary summary) {
            listener.onResponse(summary);
          }

          @Override
          public void onFailure(Throwable t) {
            listener.onFailure(
                t instanceof Exception
                    ? (Exception) t
                    : new QueryEngineException("Query failed", t));
          }
        },
        MoreExecutors.directExecutor());
  }

  private static String pipelineId(String queryId, int attempt) {
    return queryId + "-" + attempt;
  }

  private final class RunningQuery implements QueryExecution {

    private final String queryId;
    private final PhysicalPlan plan;
    private final SettableFuture<QuerySummary> completion = SettableFuture.create();
    private final long startNanos = System.nanoTime();

    private volatile State state = State.PLANNING;
    private volatile QueryCancelledException.Reason cancelReason;
    private volatile ScheduledFuture<?> timeoutTask;

    // Guarded by this.
    private PipelineExecutor current;
    private int attempts;

    private RunningQuery(String queryId, PhysicalPlan plan) {
      this.queryId = queryId;
      this.plan = plan;
    }

    private void start(Pipeline pipeline) {
      state = State.RUNNING;
      if (timeoutMillis > 0) {
        timeoutTask =
            workerPool.schedule(
                () -> cancel(QueryCancelledException.Reason.TIMEOUT),
                timeoutMillis,
                TimeUnit.MILLISECONDS);
      }
      run(pipeline);
    }

    private void run(Pipeline pipeline) {
      PipelineExecutor executor = new PipelineExecutor(pipeline, workerPool);
      QueryCancelledException.Reason pendingCancel;
      synchronized (this) {
        current = executor;
        attempts++;
        pendingCancel = cancelReason;
      }
      Futures.addCallback(
          executor.start(),
          new FutureCallback<ExecutionStats>() {
            @Override
            public void onSuccess(ExecutionStats stats) {
              release(pipeline);
              succeed(stats);
            }

            @Override
            public void onFailure(Throwable t) {
              release(pipeline);
              retryOrFail(t);
            }
          },
          MoreExecutors.directExecutor());
      if (pendingCancel != null) {
        executor.cancel(pendingCancel);
      }
    }

    private void release(Pipeline pipeline) {
      for (String exchangeId : pipeline.getExchangeIds()) {
        exchangeManager.release(exchangeId);
      }
    }

    private void retryOrFail(Throwable t) {
      int attempt;
      synchronized (this) {
        attempt = attempts;
      }
      if (t instanceof ExchangeException && attempt <= maxRetries && cancelReason == null) {
        log.warn("Query {} attempt {} failed, retrying", queryId, attempt, t);
        Pipeline next;
        try {
          next = pipelineBuilder.build(plan, pipelineId(queryId, attempt + 1));
        } catch (QueryEngineException e) {
          fail(e);
          return;
        }
        run(next);
        return;
      }
      fail(t);
    }

    private void succeed(ExecutionStats stats) {
      cancelTimeout();
      QuerySummary summary =
          QuerySummary.of(queryId, stats, System.nanoTime() - startNanos, getAttempts());
      state = State.FINISHED;
      log.info(
          "Query {} finished: {} rows in {} ms",
          queryId,
          summary.getResultRows(),
          summary.getElapsedTimeMillis());
      completion.set(summary);
    }

    private void fail(Throwable t) {
      cancelTimeout();
      if (t instanceof QueryCancelledException) {
        state = State.CANCELLED;
        log.info("Query {} cancelled: {}", queryId, ((QueryCancelledException) t).getReason());
      } else {
        state = State.FAILED;
        log.error("Query {} failed", queryId, t);
      }
      completion.setException(t);
    }

    private void cancelTimeout() {
      ScheduledFuture<?> task = timeoutTask;
      if (task != null) {
        task.cancel(false);
      }
    }

    private void cancel(QueryCancelledException.Reason reason) {
      PipelineExecutor executor;
      synchronized (this) {
        if (cancelReason != null || completion.isDone()) {
          return;
        }
        cancelReason = reason;
        executor = current;
      }
      if (executor != null) {
        executor.cancel(reason);
      }
    }

    @Override
    public String getQueryId() {
      return queryId;
    }

    @Override
    public PhysicalPlan getPlan() {
      return plan;
    }

    @Override
    public State getState() {
      return state;
    }

    @Override
    public synchronized int getAttempts() {
      return attempts;
    }

    @Override
    public void cancel() {
      cancel(QueryCancelledException.Reason.USER);
    }

    @Override
    public QuerySummary await() {
      try {
        return completion.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        cancel();
        throw new QueryCancelledException(QueryCancelledException.Reason.USER);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        throw new QueryEngineException("Query " + queryId + " failed", cause);
      }
    }

    @Override
    public synchronized ResultCollector getResult() {
      return current == null ? null : current.getPipeline().getResultCollector();
    }
  }
}
