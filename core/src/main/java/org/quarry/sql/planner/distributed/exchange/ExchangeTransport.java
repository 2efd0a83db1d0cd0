/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import com.google.common.util.concurrent.ListenableFuture;

/**
 * Moves frames from the senders of one exchange to its receivers. Every (source, destination)
 * pair is a FIFO channel. No method blocks: a full or empty channel is reported through the
 * return value, and the caller waits on the matching future.
 */
public interface ExchangeTransport {

  /** Returns the number of sending lanes. */
  int getSenderCount();

  /** Returns the number of receiving lanes. */
  int getReceiverCount();

  /**
   * Offers a frame to its channel.
   *
   * @return false if the channel is full; END frames are always accepted
   */
  boolean send(ExchangeFrame frame);

  /** Returns a future completing once the channel from source to destination has room. */
  ListenableFuture<?> whenWritable(int source, int destination);

  /** Takes the next frame for the destination from any source, or returns null if none. */
  ExchangeFrame receive(int destination);

  /** Takes the next frame of one source's channel to the destination, or returns null. */
  ExchangeFrame receive(int destination, int source);

  /** Returns a future completing once some frame for the destination is available. */
  ListenableFuture<?> whenReadable(int destination);

  /** Returns a future completing once a frame from the source to the destination is available. */
  ListenableFuture<?> whenReadable(int destination, int source);

  /**
   * Called by a receiver that wants no more data. Frames queued for the destination are dropped
   * and senders waiting on it are woken. Later sends to it are accepted and discarded.
   */
  void abort(int destination);

  /** Returns true once the destination was aborted. */
  boolean isAborted(int destination);
}
