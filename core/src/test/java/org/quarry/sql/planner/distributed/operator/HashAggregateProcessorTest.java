/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.quarry.sql.planner.distributed.TestPages.row;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quarry.sql.planner.distributed.TestPages;
import org.quarry.sql.planner.distributed.aggregation.AggregateCall;
import org.quarry.sql.planner.distributed.aggregation.AggregateFunction;
import org.quarry.sql.planner.distributed.executor.PipelineExecutor;
import org.quarry.sql.planner.distributed.executor.WorkerPool;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.pipeline.Pipeline;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class HashAggregateProcessorTest {

  private static WorkerPool pool;

  private final PageSchema schema = TestPages.longSchema("g", "v");

  private final List<AggregateCall> calls =
      List.of(
          AggregateCall.of(AggregateFunction.SUM, 1, "total"),
          AggregateCall.countAll("cnt"),
          AggregateCall.of(AggregateFunction.AVG, 1, "mean"));

  @BeforeAll
  static void startPool() {
    pool = new WorkerPool(2, 16);
  }

  @AfterAll
  static void stopPool() {
    pool.close();
  }

  private ResultCollector aggregate(int[] groupChannels, List<Page> input) {
    Pipeline pipeline = new Pipeline("agg");
    ValuesSource source = pipeline.add(new ValuesSource(TestPages.context("values"), input));
    HashAggregateBuildProcessor partial =
        pipeline.add(
            new HashAggregateBuildProcessor(
                TestPages.context("partial"), schema, groupChannels, calls));
    HashAggregateFinalizeProcessor finalStep =
        pipeline.add(
            new HashAggregateFinalizeProcessor(
                TestPages.context("final"),
                partial.getOutputSchema(),
                groupChannels.length,
                calls));
    ResultCollector collector =
        new ResultCollector(finalStep.getOutputSchema().getColumnNames());
    ResultSinkProcessor sink =
        pipeline.add(new ResultSinkProcessor(TestPages.context("result"), collector));
    pipeline.connect(source, 0, partial, 0);
    pipeline.connect(partial, 0, finalStep, 0);
    pipeline.connect(finalStep, 0, sink, 0);
    new PipelineExecutor(pipeline, pool).run();
    return collector;
  }

  @Test
  void should_aggregate_by_group() {
    ResultCollector result =
        aggregate(
            new int[] {0},
            List.of(
                TestPages.page(schema, row(1L, 10L), row(2L, 5L)),
                TestPages.page(schema, row(1L, 20L), row(2L, null))));

    assertEquals(List.of("g", "total", "cnt", "mean"), result.getFieldNames());
    assertEquals(
        List.of(List.of(1L, 30L, 2L, 15.0), List.of(2L, 5L, 2L, 5.0)),
        TestPages.sortedByFirst(result.getRows()));
  }

  @Test
  void should_emit_single_row_for_global_aggregate_of_empty_input() {
    ResultCollector result = aggregate(new int[0], List.of());

    assertEquals(1, result.getRowCount());
    assertEquals(Arrays.asList(null, 0L, null), result.getRows().get(0));
  }
}
