/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.executor;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.quarry.sql.planner.distributed.processor.ProcessorKind;

/** Counters of one finished pipeline run. */
@Getter
@RequiredArgsConstructor
public class ExecutionStats {

  /** Rows emitted by source and exchange-receive processors. */
  private final long processedRows;

  /** Bytes emitted by source and exchange-receive processors. */
  private final long processedBytes;

  /** Rows consumed by the result sink. */
  private final long resultRows;

  /** Total number of {@code execute} calls across all processors. */
  private final long executeCount;

  /** Nanoseconds spent by workers inside the scheduler, outside processor work. */
  private final long schedulingNanos;

  private final long elapsedNanos;

  private final List<ProcessorSummary> processors;

  /** Per-processor counters. */
  @Data
  @AllArgsConstructor
  public static class ProcessorSummary {
    private String name;
    private ProcessorKind kind;
    private long inputRows;
    private long outputRows;
    private long outputBytes;
    private long executeCount;
    private long executeNanos;
  }
}
