/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.execution;

import org.quarry.sql.planner.distributed.operator.ResultCollector;
import org.quarry.sql.planner.physical.PhysicalPlan;

/**
 * Handle of one submitted query. The query runs as one pipeline at a time; a retried query runs a
 * fresh pipeline for each attempt.
 */
public interface QueryExecution {

  /** Query execution states. */
  enum State {
    PLANNING,
    RUNNING,
    FINISHED,
    FAILED,
    CANCELLED
  }

  /** Returns the unique query identifier. */
  String getQueryId();

  /** Returns the physical plan being executed. */
  PhysicalPlan getPlan();

  /** Returns the current execution state. */
  State getState();

  /** Returns the number of pipelines started so far, including the current one. */
  int getAttempts();

  /** Cancels the query. Idempotent. */
  void cancel();

  /**
   * Blocks until the query is done.
   *
   * @return the summary of the successful attempt
   * @throws org.quarry.sql.exception.QueryEngineException the terminal error of the query
   */
  QuerySummary await();

  /** Returns the rows collected by the result sink of the latest attempt. */
  ResultCollector getResult();
}
