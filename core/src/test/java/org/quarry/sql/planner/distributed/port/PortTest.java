/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.port;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.quarry.sql.planner.distributed.TestPages;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.processor.Processor;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PortTest {

  @Mock private Processor producer;
  @Mock private Processor consumer;

  private Port port;
  private Page page;

  @BeforeEach
  void setUp() {
    port = new Port(0);
    port.bind(producer, consumer);
    page = TestPages.sequence(TestPages.longSchema("x"), 1, 3);
  }

  @Test
  void should_hold_one_page_at_a_time() {
    port.push(page);

    assertTrue(port.hasData());
    assertFalse(port.canPush());
    assertThrows(IllegalStateException.class, () -> port.push(page));

    assertSame(page, port.pull());
    assertTrue(port.canPush());
    assertNull(port.pull());
  }

  @Test
  void should_signal_consumer_on_push_and_producer_on_pull() {
    port.push(page);
    assertTrue(port.takeConsumerSignal());
    assertFalse(port.takeConsumerSignal());
    assertFalse(port.takeProducerSignal());

    port.pull();
    assertTrue(port.takeProducerSignal());
  }

  @Test
  void should_clear_need_data_on_push() {
    port.setNeedData();
    assertTrue(port.isNeedData());
    assertTrue(port.takeProducerSignal());

    port.push(page);
    assertFalse(port.isNeedData());
  }

  @Test
  void should_be_finished_only_after_slot_is_drained() {
    port.push(page);
    port.finish();

    assertTrue(port.isProducerFinished());
    assertFalse(port.isFinished());

    port.pull();
    assertTrue(port.isFinished());
  }

  @Test
  void should_reject_push_after_finish() {
    port.finish();
    assertThrows(IllegalStateException.class, () -> port.push(page));
  }

  @Test
  void should_drop_pages_pushed_after_close() {
    port.push(page);
    port.close();

    assertTrue(port.isFinished());
    assertFalse(port.hasData());
    assertTrue(port.takeProducerSignal());

    port.push(page);
    assertFalse(port.hasData());
    assertFalse(port.canPush());
  }

  @Test
  void should_keep_first_error() {
    IllegalStateException first = new IllegalStateException("first");
    port.fail(first);
    port.fail(new IllegalStateException("second"));

    assertSame(first, port.getError());
    assertTrue(port.isProducerFinished());
  }

  @Test
  void should_refuse_second_binding() {
    assertThrows(IllegalStateException.class, () -> port.bind(producer, consumer));
  }
}
