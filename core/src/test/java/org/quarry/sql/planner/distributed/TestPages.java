/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.quarry.sql.planner.distributed.executor.PipelineExecutor;
import org.quarry.sql.planner.distributed.executor.WorkerPool;
import org.quarry.sql.planner.distributed.operator.ResultCollector;
import org.quarry.sql.planner.distributed.operator.ResultSinkProcessor;
import org.quarry.sql.planner.distributed.operator.ValuesSource;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Column;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageBuilder;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.pipeline.Pipeline;
import org.quarry.sql.planner.distributed.processor.Processor;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;

/** Page and pipeline fixtures shared by the engine tests. */
public final class TestPages {

  private TestPages() {}

  /** Schema of nullable LONG columns with the given names. */
  public static PageSchema longSchema(String... names) {
    List<Column> columns = new ArrayList<>();
    for (String name : names) {
      columns.add(Column.of(name, BlockType.LONG));
    }
    return new PageSchema(columns);
  }

  public static Page page(PageSchema schema, Object[]... rows) {
    PageBuilder builder = new PageBuilder(schema);
    for (Object[] row : rows) {
      builder.appendRow(row);
    }
    return builder.build();
  }

  /** One-column LONG page holding {@code from..to} inclusive. */
  public static Page sequence(PageSchema schema, long from, long to) {
    PageBuilder builder = new PageBuilder(schema);
    for (long value = from; value <= to; value++) {
      builder.appendRow(value);
    }
    return builder.build();
  }

  public static Object[] row(Object... values) {
    return values;
  }

  public static List<List<Object>> rows(Page page) {
    List<List<Object>> rows = new ArrayList<>();
    for (int position = 0; position < page.getPositionCount(); position++) {
      List<Object> row = new ArrayList<>();
      for (int channel = 0; channel < page.getChannelCount(); channel++) {
        row.add(page.getValue(position, channel));
      }
      rows.add(row);
    }
    return rows;
  }

  /** Sorts rows by their first column, which must hold comparable longs. */
  public static List<List<Object>> sortedByFirst(List<List<Object>> rows) {
    List<List<Object>> sorted = new ArrayList<>(rows);
    sorted.sort(Comparator.comparing(row -> (Long) row.get(0)));
    return sorted;
  }

  public static ProcessorContext context(String name) {
    return ProcessorContext.createDefault(name);
  }

  /**
   * Runs {@code values -> transform -> result} on the pool and returns the collected rows.
   * Rethrows the terminal error of the run.
   */
  public static ResultCollector runThrough(
      WorkerPool pool, Processor transform, PageSchema outputSchema, List<Page> input) {
    Pipeline pipeline = new Pipeline("test-" + transform.getName());
    ValuesSource source = pipeline.add(new ValuesSource(context("values"), input));
    pipeline.add(transform);
    ResultCollector collector = new ResultCollector(outputSchema.getColumnNames());
    ResultSinkProcessor sink = pipeline.add(new ResultSinkProcessor(context("result"), collector));
    pipeline.connect(source, 0, transform, 0);
    pipeline.connect(transform, 0, sink, 0);
    new PipelineExecutor(pipeline, pool).run();
    return collector;
  }
}
