/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.quarry.sql.planner.distributed.TestPages.context;
import static org.quarry.sql.planner.distributed.TestPages.longSchema;
import static org.quarry.sql.planner.distributed.TestPages.sequence;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quarry.sql.common.setting.DefaultSettings;
import org.quarry.sql.common.setting.Settings;
import org.quarry.sql.exception.QueryEngineException;
import org.quarry.sql.planner.distributed.operator.ResultCollector;
import org.quarry.sql.planner.distributed.operator.ResultSinkProcessor;
import org.quarry.sql.planner.distributed.operator.ValuesSource;
import org.quarry.sql.planner.distributed.pipeline.Pipeline;
import org.quarry.sql.planner.distributed.pipeline.PipelineContext;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class WorkerPoolTest {

  @Test
  void should_read_size_and_quantum_from_settings() {
    try (WorkerPool pool =
        WorkerPool.fromSettings(
            DefaultSettings.of(
                Map.of(Settings.Key.WORKER_THREADS, 3, Settings.Key.WORKER_QUANTUM, 5)))) {
      assertEquals(3, pool.getThreadCount());
      assertEquals(5, pool.getQuantum());
    }
  }

  @Test
  void should_reject_invalid_sizes() {
    assertThrows(IllegalArgumentException.class, () -> new WorkerPool(0, 1));
    assertThrows(IllegalArgumentException.class, () -> new WorkerPool(1, 0));
  }

  @Test
  void should_fail_pipeline_started_on_closed_pool() {
    WorkerPool pool = new WorkerPool(1, 4);
    pool.close();
    Pipeline pipeline = new Pipeline("closed");
    ValuesSource source =
        pipeline.add(new ValuesSource(context("values"), List.of(sequence(longSchema("x"), 1, 3))));
    ResultSinkProcessor sink =
        pipeline.add(new ResultSinkProcessor(context("result"), new ResultCollector(List.of("x"))));
    pipeline.connect(source, 0, sink, 0);

    QueryEngineException error =
        assertThrows(QueryEngineException.class, () -> new PipelineExecutor(pipeline, pool).run());

    assertTrue(pool.isShutdown());
    assertTrue(error.getMessage().contains("shut down"));
    assertEquals(PipelineContext.Status.FAILED, pipeline.getContext().getStatus());
  }
}
