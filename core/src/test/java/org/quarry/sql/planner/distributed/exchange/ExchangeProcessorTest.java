/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;
import static org.quarry.sql.planner.distributed.TestPages.context;
import static org.quarry.sql.planner.distributed.TestPages.longSchema;
import static org.quarry.sql.planner.distributed.TestPages.page;
import static org.quarry.sql.planner.distributed.TestPages.row;
import static org.quarry.sql.planner.distributed.TestPages.sequence;
import static org.quarry.sql.planner.distributed.TestPages.sortedByFirst;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.quarry.sql.exception.ExchangeException;
import org.quarry.sql.planner.distributed.executor.PipelineExecutor;
import org.quarry.sql.planner.distributed.executor.WorkerPool;
import org.quarry.sql.planner.distributed.operator.LimitProcessor;
import org.quarry.sql.planner.distributed.operator.ResultCollector;
import org.quarry.sql.planner.distributed.operator.ResultSinkProcessor;
import org.quarry.sql.planner.distributed.operator.ValuesSource;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.PageSchema;
import org.quarry.sql.planner.distributed.pipeline.Pipeline;
import org.quarry.sql.planner.distributed.processor.Processor;
import org.quarry.sql.planner.distributed.sort.PageComparator;
import org.quarry.sql.planner.distributed.sort.SortKey;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExchangeProcessorTest {

  private static final PageSchema SCHEMA = longSchema("k");

  private static WorkerPool pool;

  @Mock private ExchangeTransport brokenTransport;

  @BeforeAll
  static void startPool() {
    pool = new WorkerPool(3, 16);
  }

  @AfterAll
  static void stopPool() {
    pool.close();
  }

  @Test
  void should_route_rows_by_hash_through_a_bounded_transport() {
    // Given capacity 1, so senders wait on the receivers
    LocalExchangeTransport transport = new LocalExchangeTransport("hash", 2, 2, 1);
    Pipeline pipeline = new Pipeline("hash");
    HashPartitioner partitioner = new HashPartitioner(List.of(0), 2);
    for (int sender = 0; sender < 2; sender++) {
      List<Page> pages = new ArrayList<>();
      for (int i = 0; i < 5; i++) {
        long from = sender * 100 + i * 10 + 1;
        pages.add(sequence(SCHEMA, from, from + 9));
      }
      ValuesSource source = pipeline.add(new ValuesSource(context("values#" + sender), pages));
      ExchangeSinkProcessor sink =
          pipeline.add(
              new ExchangeSinkProcessor(
                  context("send#" + sender),
                  transport,
                  sender,
                  new HashPartitioner(List.of(0), 2)));
      pipeline.connect(source, 0, sink, 0);
    }
    List<ResultCollector> collectors = new ArrayList<>();
    for (int destination = 0; destination < 2; destination++) {
      ExchangeSourceProcessor receiver =
          pipeline.add(
              new ExchangeSourceProcessor(
                  context("receive#" + destination), transport, destination));
      ResultCollector collector = new ResultCollector(SCHEMA.getColumnNames());
      collectors.add(collector);
      Processor result =
          pipeline.add(new ResultSinkProcessor(context("result#" + destination), collector));
      pipeline.connect(receiver, 0, result, 0);
    }

    // When
    new PipelineExecutor(pipeline, pool).run();

    // Then
    int total = 0;
    for (int destination = 0; destination < 2; destination++) {
      for (List<Object> values : collectors.get(destination).getRows()) {
        Page single = page(SCHEMA, row(values.get(0)));
        assertEquals(destination, partitioner.destinationOf(single, 0));
        total++;
      }
    }
    assertEquals(100, total);
    assertEquals(0, transport.getQueuedFrameCount());
  }

  @Test
  void should_merge_sorted_sender_streams() {
    LocalExchangeTransport transport = new LocalExchangeTransport("merge", 2, 1, 2);
    Pipeline pipeline = new Pipeline("merge");
    List<List<Page>> streams =
        List.of(
            List.of(page(SCHEMA, row(1L), row(4L)), page(SCHEMA, row(6L))),
            List.of(page(SCHEMA, row(2L), row(3L), row(5L), row(7L))));
    for (int sender = 0; sender < 2; sender++) {
      ValuesSource source =
          pipeline.add(new ValuesSource(context("values#" + sender), streams.get(sender)));
      ExchangeSinkProcessor sink =
          pipeline.add(
              new ExchangeSinkProcessor(
                  context("send#" + sender), transport, sender, new SinglePartitioner()));
      pipeline.connect(source, 0, sink, 0);
    }
    MergingExchangeSourceProcessor receiver =
        pipeline.add(
            new MergingExchangeSourceProcessor(
                context("receive"),
                transport,
                0,
                SCHEMA,
                new PageComparator(List.of(SortKey.ascending("k", 0)))));
    ResultCollector collector = new ResultCollector(SCHEMA.getColumnNames());
    ResultSinkProcessor result =
        pipeline.add(new ResultSinkProcessor(context("result"), collector));
    pipeline.connect(receiver, 0, result, 0);

    new PipelineExecutor(pipeline, pool).run();

    List<List<Object>> rows = collector.getRows();
    assertEquals(7, rows.size());
    assertEquals(sortedByFirst(rows), rows);
  }

  @Test
  void should_stop_senders_once_the_consumer_above_the_exchange_is_done() {
    // Given 20 pages behind a channel of capacity 2 and a limit of 1 row
    LocalExchangeTransport transport = new LocalExchangeTransport("limit", 1, 1, 2);
    Pipeline pipeline = new Pipeline("limit");
    List<Page> pages = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      pages.add(sequence(SCHEMA, i * 10 + 1, i * 10 + 10));
    }
    ValuesSource source = pipeline.add(new ValuesSource(context("values"), pages));
    ExchangeSinkProcessor sink =
        pipeline.add(
            new ExchangeSinkProcessor(context("send"), transport, 0, new RoundRobinPartitioner(1)));
    ExchangeSourceProcessor receiver =
        pipeline.add(new ExchangeSourceProcessor(context("receive"), transport, 0));
    LimitProcessor limit = pipeline.add(new LimitProcessor(context("limit"), 1, 0));
    ResultCollector collector = new ResultCollector(SCHEMA.getColumnNames());
    ResultSinkProcessor result =
        pipeline.add(new ResultSinkProcessor(context("result"), collector));
    pipeline.connect(source, 0, sink, 0);
    pipeline.connect(receiver, 0, limit, 0);
    pipeline.connect(limit, 0, result, 0);

    // When
    assertTimeoutPreemptively(
        Duration.ofSeconds(10), () -> new PipelineExecutor(pipeline, pool).run());

    // Then
    assertEquals(List.of(List.of(1L)), collector.getRows());
    assertTrue(transport.isAborted(0));
    assertEquals(0, transport.getQueuedFrameCount());
  }

  @Test
  void should_stop_senders_once_the_consumer_above_a_merging_exchange_is_done() {
    LocalExchangeTransport transport = new LocalExchangeTransport("top", 2, 1, 1);
    Pipeline pipeline = new Pipeline("top");
    for (int sender = 0; sender < 2; sender++) {
      List<Page> pages = new ArrayList<>();
      for (int i = 0; i < 10; i++) {
        long from = i * 100 + sender * 10 + 1;
        pages.add(sequence(SCHEMA, from, from + 4));
      }
      ValuesSource source = pipeline.add(new ValuesSource(context("values#" + sender), pages));
      ExchangeSinkProcessor sink =
          pipeline.add(
              new ExchangeSinkProcessor(
                  context("send#" + sender), transport, sender, new SinglePartitioner()));
      pipeline.connect(source, 0, sink, 0);
    }
    MergingExchangeSourceProcessor receiver =
        pipeline.add(
            new MergingExchangeSourceProcessor(
                context("receive"),
                transport,
                0,
                SCHEMA,
                new PageComparator(List.of(SortKey.ascending("k", 0)))));
    LimitProcessor limit = pipeline.add(new LimitProcessor(context("limit"), 3, 0));
    ResultCollector collector = new ResultCollector(SCHEMA.getColumnNames());
    ResultSinkProcessor result =
        pipeline.add(new ResultSinkProcessor(context("result"), collector));
    pipeline.connect(receiver, 0, limit, 0);
    pipeline.connect(limit, 0, result, 0);

    assertTimeoutPreemptively(
        Duration.ofSeconds(10), () -> new PipelineExecutor(pipeline, pool).run());

    assertEquals(List.of(List.of(1L), List.of(2L), List.of(3L)), collector.getRows());
    assertTrue(transport.isAborted(0));
  }

  @Test
  void should_deliver_every_page_to_every_receiver_under_broadcast() {
    LocalExchangeTransport transport = new LocalExchangeTransport("broadcast", 1, 3, 2);
    Pipeline pipeline = new Pipeline("broadcast");
    ValuesSource source =
        pipeline.add(
            new ValuesSource(
                context("values"),
                List.of(sequence(SCHEMA, 1, 4), sequence(SCHEMA, 5, 8), sequence(SCHEMA, 9, 10))));
    ExchangeSinkProcessor sink =
        pipeline.add(
            new ExchangeSinkProcessor(context("send"), transport, 0, new BroadcastPartitioner(3)));
    pipeline.connect(source, 0, sink, 0);
    List<ResultCollector> collectors = receivers(pipeline, transport, 3);

    new PipelineExecutor(pipeline, pool).run();

    List<List<Object>> expected = new ArrayList<>();
    for (long value = 1; value <= 10; value++) {
      expected.add(List.of(value));
    }
    for (ResultCollector collector : collectors) {
      assertEquals(expected, sortedByFirst(collector.getRows()));
    }
  }

  @Test
  void should_deliver_each_page_to_exactly_one_receiver_under_round_robin() {
    LocalExchangeTransport transport = new LocalExchangeTransport("spread", 1, 2, 2);
    Pipeline pipeline = new Pipeline("spread");
    List<Page> pages = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      pages.add(sequence(SCHEMA, i * 3 + 1, i * 3 + 3));
    }
    ValuesSource source = pipeline.add(new ValuesSource(context("values"), pages));
    ExchangeSinkProcessor sink =
        pipeline.add(
            new ExchangeSinkProcessor(context("send"), transport, 0, new RoundRobinPartitioner(2)));
    pipeline.connect(source, 0, sink, 0);
    List<ResultCollector> collectors = receivers(pipeline, transport, 2);

    new PipelineExecutor(pipeline, pool).run();

    // Pages alternate between the receivers, starting with receiver 0
    for (int destination = 0; destination < 2; destination++) {
      List<List<Object>> expected = new ArrayList<>();
      for (int i = destination; i < 6; i += 2) {
        for (long value = i * 3 + 1; value <= i * 3 + 3; value++) {
          expected.add(List.of(value));
        }
      }
      assertEquals(expected, collectors.get(destination).getRows());
    }
  }

  private static List<ResultCollector> receivers(
      Pipeline pipeline, ExchangeTransport transport, int count) {
    List<ResultCollector> collectors = new ArrayList<>();
    for (int destination = 0; destination < count; destination++) {
      ExchangeSourceProcessor receiver =
          pipeline.add(
              new ExchangeSourceProcessor(
                  context("receive#" + destination), transport, destination));
      ResultCollector collector = new ResultCollector(SCHEMA.getColumnNames());
      collectors.add(collector);
      ResultSinkProcessor result =
          pipeline.add(new ResultSinkProcessor(context("result#" + destination), collector));
      pipeline.connect(receiver, 0, result, 0);
    }
    return collectors;
  }

  @Test
  void should_fail_with_exchange_error_on_undecodable_frame() {
    LocalExchangeTransport transport = new LocalExchangeTransport("bad", 1, 1, 4);
    transport.send(ExchangeFrame.data(0, 0, "garbage".getBytes(StandardCharsets.UTF_8)));
    transport.send(ExchangeFrame.end(0, 0));
    Pipeline pipeline = new Pipeline("bad");
    ExchangeSourceProcessor receiver =
        pipeline.add(new ExchangeSourceProcessor(context("receive"), transport, 0));
    ResultSinkProcessor result =
        pipeline.add(
            new ResultSinkProcessor(
                context("result"), new ResultCollector(SCHEMA.getColumnNames())));
    pipeline.connect(receiver, 0, result, 0);

    ExchangeException error =
        assertThrows(ExchangeException.class, () -> new PipelineExecutor(pipeline, pool).run());

    assertEquals("receive", error.getProcessorName());
  }

  @Test
  void should_wrap_transport_failures() {
    when(brokenTransport.getSenderCount()).thenReturn(1);
    when(brokenTransport.receive(0)).thenThrow(new IllegalStateException("connection reset"));
    Pipeline pipeline = new Pipeline("broken");
    ExchangeSourceProcessor receiver =
        pipeline.add(new ExchangeSourceProcessor(context("receive"), brokenTransport, 0));
    ResultSinkProcessor result =
        pipeline.add(
            new ResultSinkProcessor(
                context("result"), new ResultCollector(SCHEMA.getColumnNames())));
    pipeline.connect(receiver, 0, result, 0);

    ExchangeException error =
        assertThrows(ExchangeException.class, () -> new PipelineExecutor(pipeline, pool).run());

    assertTrue(error.getMessage().contains("connection reset"));
  }
}
