/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.quarry.sql.planner.distributed.TestPages.context;
import static org.quarry.sql.planner.distributed.TestPages.longSchema;
import static org.quarry.sql.planner.distributed.TestPages.page;
import static org.quarry.sql.planner.distributed.TestPages.row;
import static org.quarry.sql.planner.distributed.TestPages.sequence;
import static org.quarry.sql.planner.distributed.TestPages.sortedByFirst;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quarry.sql.planner.distributed.executor.PipelineExecutor;
import org.quarry.sql.planner.distributed.executor.WorkerPool;
import org.quarry.sql.planner.distributed.operator.LimitProcessor;
import org.quarry.sql.planner.distributed.operator.ResultCollector;
import org.quarry.sql.planner.distributed.operator.ResultSinkProcessor;
import org.quarry.sql.planner.distributed.operator.ValuesSource;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.pipeline.Pipeline;
import org.quarry.sql.planner.distributed.sort.PageComparator;
import org.quarry.sql.planner.distributed.sort.SortKey;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class MultiInputProcessorTest {

  private static final PageSchema SCHEMA = longSchema("x");

  private static WorkerPool pool;

  @BeforeAll
  static void startPool() {
    pool = new WorkerPool(2, 16);
  }

  @AfterAll
  static void stopPool() {
    pool.close();
  }

  @Test
  void should_union_all_rows_of_every_input() {
    Pipeline pipeline = new Pipeline("union");
    ValuesSource left =
        pipeline.add(
            new ValuesSource(
                context("left"), List.of(sequence(SCHEMA, 1, 3), sequence(SCHEMA, 4, 5))));
    ValuesSource right =
        pipeline.add(new ValuesSource(context("right"), List.of(sequence(SCHEMA, 6, 9))));
    ValuesSource empty = pipeline.add(new ValuesSource(context("empty"), List.of()));
    UnionProcessor union = pipeline.add(new UnionProcessor(context("union"), 3));
    ResultCollector collector = new ResultCollector(SCHEMA.getColumnNames());
    ResultSinkProcessor sink = pipeline.add(new ResultSinkProcessor(context("result"), collector));
    pipeline.connect(left, 0, union, 0);
    pipeline.connect(right, 0, union, 1);
    pipeline.connect(empty, 0, union, 2);
    pipeline.connect(union, 0, sink, 0);

    new PipelineExecutor(pipeline, pool).run();

    List<List<Object>> expected = new ArrayList<>();
    for (long value = 1; value <= 9; value++) {
      expected.add(List.of(value));
    }
    assertEquals(expected, sortedByFirst(collector.getRows()));
  }

  @Test
  void should_merge_sorted_inputs_into_sorted_output() {
    PageSchema schema = longSchema("k", "v");
    Pipeline pipeline = new Pipeline("merge");
    ValuesSource first =
        pipeline.add(
            new ValuesSource(
                context("first"),
                List.of(
                    page(schema, row(1L, 10L), row(4L, 40L)),
                    page(schema, row(7L, 70L), row(9L, 90L)))));
    ValuesSource second =
        pipeline.add(
            new ValuesSource(
                context("second"),
                List.of(page(schema, row(2L, 20L), row(3L, 30L), row(8L, 80L)))));
    ValuesSource third =
        pipeline.add(
            new ValuesSource(
                context("third"),
                List.of(page(schema, row(5L, 50L)), page(schema, row(null, 0L)))));
    PageComparator comparator = new PageComparator(List.of(SortKey.ascending("k", 0)));
    SortedMergeProcessor merge =
        pipeline.add(new SortedMergeProcessor(context("merge"), 3, schema, comparator));
    ResultCollector collector = new ResultCollector(schema.getColumnNames());
    ResultSinkProcessor sink = pipeline.add(new ResultSinkProcessor(context("result"), collector));
    pipeline.connect(first, 0, merge, 0);
    pipeline.connect(second, 0, merge, 1);
    pipeline.connect(third, 0, merge, 2);
    pipeline.connect(merge, 0, sink, 0);

    new PipelineExecutor(pipeline, pool).run();

    List<Object> keys = new ArrayList<>();
    for (List<Object> row : collector.getRows()) {
      keys.add(row.get(0));
    }
    assertEquals(Arrays.asList(1L, 2L, 3L, 4L, 5L, 7L, 8L, 9L, null), keys);
  }

  @Test
  void should_copy_every_page_to_each_output() {
    Pipeline pipeline = new Pipeline("duplicate");
    ValuesSource source =
        pipeline.add(
            new ValuesSource(
                context("values"), List.of(sequence(SCHEMA, 1, 4), sequence(SCHEMA, 5, 6))));
    DuplicateProcessor duplicate = pipeline.add(new DuplicateProcessor(context("duplicate"), 2));
    ResultCollector left = new ResultCollector(SCHEMA.getColumnNames());
    ResultCollector right = new ResultCollector(SCHEMA.getColumnNames());
    ResultSinkProcessor leftSink = pipeline.add(new ResultSinkProcessor(context("left"), left));
    ResultSinkProcessor rightSink = pipeline.add(new ResultSinkProcessor(context("right"), right));
    pipeline.connect(source, 0, duplicate, 0);
    pipeline.connect(duplicate, 0, leftSink, 0);
    pipeline.connect(duplicate, 1, rightSink, 0);

    new PipelineExecutor(pipeline, pool).run();

    assertEquals(6, left.getRowCount());
    assertEquals(left.getRows(), right.getRows());
  }

  @Test
  void should_keep_feeding_remaining_output_after_one_consumer_stops() {
    Pipeline pipeline = new Pipeline("duplicate-limit");
    ValuesSource source =
        pipeline.add(
            new ValuesSource(
                context("values"),
                List.of(sequence(SCHEMA, 1, 2), sequence(SCHEMA, 3, 4), sequence(SCHEMA, 5, 6))));
    DuplicateProcessor duplicate = pipeline.add(new DuplicateProcessor(context("duplicate"), 2));
    LimitProcessor limit = pipeline.add(new LimitProcessor(context("limit"), 1, 0));
    ResultCollector limited = new ResultCollector(SCHEMA.getColumnNames());
    ResultCollector full = new ResultCollector(SCHEMA.getColumnNames());
    ResultSinkProcessor limitedSink =
        pipeline.add(new ResultSinkProcessor(context("limited"), limited));
    ResultSinkProcessor fullSink = pipeline.add(new ResultSinkProcessor(context("full"), full));
    pipeline.connect(source, 0, duplicate, 0);
    pipeline.connect(duplicate, 0, limit, 0);
    pipeline.connect(limit, 0, limitedSink, 0);
    pipeline.connect(duplicate, 1, fullSink, 0);

    new PipelineExecutor(pipeline, pool).run();

    assertEquals(List.of(List.of(1L)), limited.getRows());
    assertEquals(6, full.getRowCount());
  }
}
