/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.util.concurrent.ListenableFuture;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.quarry.sql.exception.PipelineConstructionException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LocalExchangeTransportTest {

  private static ExchangeFrame data(int source, int destination, int marker) {
    return ExchangeFrame.data(source, destination, new byte[] {(byte) marker});
  }

  @Test
  void should_refuse_data_beyond_capacity_until_a_frame_is_taken() {
    LocalExchangeTransport transport = new LocalExchangeTransport("q/1", 1, 1, 2);
    assertTrue(transport.send(data(0, 0, 1)));
    assertTrue(transport.send(data(0, 0, 2)));

    // When
    boolean accepted = transport.send(data(0, 0, 3));
    ListenableFuture<?> writable = transport.whenWritable(0, 0);

    // Then
    assertFalse(accepted);
    assertFalse(writable.isDone());
    assertEquals(1, transport.receive(0).getPayload()[0]);
    assertTrue(writable.isDone());
    assertTrue(transport.send(data(0, 0, 3)));
  }

  @Test
  void should_accept_end_frames_on_a_full_channel() {
    LocalExchangeTransport transport = new LocalExchangeTransport("q/1", 1, 1, 1);
    assertTrue(transport.send(data(0, 0, 1)));

    assertTrue(transport.send(ExchangeFrame.end(0, 0)));

    assertEquals(2, transport.getQueuedFrameCount());
    assertFalse(transport.receive(0).isEnd());
    assertTrue(transport.receive(0).isEnd());
    assertNull(transport.receive(0));
  }

  @Test
  void should_drop_frames_and_wake_senders_of_an_aborted_destination() {
    LocalExchangeTransport transport = new LocalExchangeTransport("q/1", 2, 2, 1);
    assertTrue(transport.send(data(0, 0, 1)));
    assertTrue(transport.send(data(1, 0, 2)));
    assertTrue(transport.send(data(0, 1, 3)));
    ListenableFuture<?> writable = transport.whenWritable(0, 0);
    assertFalse(writable.isDone());

    transport.abort(0);

    assertTrue(writable.isDone());
    assertTrue(transport.isAborted(0));
    assertFalse(transport.isAborted(1));
    assertEquals(1, transport.getQueuedFrameCount());
    assertTrue(transport.send(data(0, 0, 4)));
    assertTrue(transport.send(ExchangeFrame.end(1, 0)));
    assertTrue(transport.whenWritable(1, 0).isDone());
    assertEquals(1, transport.getQueuedFrameCount());
    assertEquals(3, transport.receive(1).getPayload()[0]);
  }

  @Test
  void should_keep_per_channel_order() {
    LocalExchangeTransport transport = new LocalExchangeTransport("q/1", 2, 1, 4);
    transport.send(data(0, 0, 1));
    transport.send(data(1, 0, 10));
    transport.send(data(0, 0, 2));
    transport.send(data(1, 0, 11));

    assertEquals(1, transport.receive(0, 0).getPayload()[0]);
    assertEquals(2, transport.receive(0, 0).getPayload()[0]);
    assertNull(transport.receive(0, 0));
    assertEquals(10, transport.receive(0, 1).getPayload()[0]);
  }

  @Test
  void should_complete_readable_future_when_a_frame_arrives() {
    LocalExchangeTransport transport = new LocalExchangeTransport("q/1", 2, 2, 4);
    ListenableFuture<?> anySource = transport.whenReadable(1);
    ListenableFuture<?> fromSecond = transport.whenReadable(1, 1);

    transport.send(data(0, 1, 1));

    assertTrue(anySource.isDone());
    assertFalse(fromSecond.isDone());
    assertFalse(transport.whenReadable(0).isDone());

    transport.send(ExchangeFrame.end(1, 1));
    assertTrue(fromSecond.isDone());
  }

  @Test
  void should_reject_frames_for_unknown_lanes() {
    LocalExchangeTransport transport = new LocalExchangeTransport("q/1", 1, 2, 4);

    assertThrows(IndexOutOfBoundsException.class, () -> transport.send(data(0, 2, 1)));
    assertThrows(IndexOutOfBoundsException.class, () -> transport.receive(5));
  }

  @Test
  void should_reject_duplicate_exchange_ids_until_released() {
    LocalExchangeManager manager = new LocalExchangeManager(4);
    manager.createTransport("q-1/3", 2, 2);

    assertThrows(
        PipelineConstructionException.class, () -> manager.createTransport("q-1/3", 1, 1));

    manager.release("q-1/3");
    assertEquals(0, manager.getTransportCount());
    manager.createTransport("q-1/3", 1, 1);
    assertEquals(1, manager.getTransportCount());
  }
}
