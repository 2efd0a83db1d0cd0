/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.execution;

import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.quarry.sql.planner.distributed.executor.ExecutionStats;

/** Statistics of a finished query. */
@Getter
@ToString
@RequiredArgsConstructor
public class QuerySummary {

  private final String queryId;
  private final long processedRows;
  private final long processedBytes;
  private final long resultRows;
  private final long schedulingTimeMillis;
  private final long elapsedTimeMillis;
  private final int attempts;

  static QuerySummary of(String queryId, ExecutionStats stats, long elapsedNanos, int attempts) {
    return new QuerySummary(
        queryId,
        stats.getProcessedRows(),
        stats.getProcessedBytes(),
        stats.getResultRows(),
        TimeUnit.NANOSECONDS.toMillis(stats.getSchedulingNanos()),
        TimeUnit.NANOSECONDS.toMillis(elapsedNanos),
        attempts);
  }
}
