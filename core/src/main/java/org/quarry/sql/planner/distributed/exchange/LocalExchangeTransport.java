/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * In-memory transport for lanes running in one process. Each (source, destination) channel is a
 * bounded queue of data frames; END frames do not count against the capacity. Waiting futures are
 * completed outside the lock so their callbacks never run while it is held.
 */
public class LocalExchangeTransport implements ExchangeTransport {

  @Getter private final String exchangeId;
  private final int senderCount;
  private final int receiverCount;
  private final int capacity;
  private final Channel[][] channels;
  private final SettableFuture<?>[] readable;
  private final int[] nextSource;
  private final boolean[] aborted;

  public LocalExchangeTransport(
      String exchangeId, int senderCount, int receiverCount, int capacity) {
    Preconditions.checkArgument(senderCount > 0, "senderCount must be positive");
    Preconditions.checkArgument(receiverCount > 0, "receiverCount must be positive");
    Preconditions.checkArgument(capacity > 0, "capacity must be positive");
    this.exchangeId = exchangeId;
    this.senderCount = senderCount;
    this.receiverCount = receiverCount;
    this.capacity = capacity;
    this.channels = new Channel[senderCount][receiverCount];
    for (int source = 0; source < senderCount; source++) {
      for (int destination = 0; destination < receiverCount; destination++) {
        channels[source][destination] = new Channel();
      }
    }
    this.readable = new SettableFuture<?>[receiverCount];
    this.nextSource = new int[receiverCount];
    this.aborted = new boolean[receiverCount];
  }

  @Override
  public int getSenderCount() {
    return senderCount;
  }

  @Override
  public int getReceiverCount() {
    return receiverCount;
  }

  @Override
  public boolean send(ExchangeFrame frame) {
    SettableFuture<?> wake;
    SettableFuture<?> wakeChannel;
    synchronized (this) {
      Channel channel = channel(frame.getSourceId(), frame.getDestinationId());
      if (aborted[frame.getDestinationId()]) {
        return true;
      }
      if (!frame.isEnd() && channel.dataFrames >= capacity) {
        return false;
      }
      channel.frames.add(frame);
      if (!frame.isEnd()) {
        channel.dataFrames++;
      }
      wake = readable[frame.getDestinationId()];
      readable[frame.getDestinationId()] = null;
      wakeChannel = channel.readable;
      channel.readable = null;
    }
    complete(wake);
    complete(wakeChannel);
    return true;
  }

  @Override
  public synchronized ListenableFuture<?> whenWritable(int source, int destination) {
    Channel channel = channel(source, destination);
    if (aborted[destination] || channel.dataFrames < capacity) {
      return Futures.immediateVoidFuture();
    }
    if (channel.writable == null) {
      channel.writable = SettableFuture.create();
    }
    return channel.writable;
  }

  @Override
  public ExchangeFrame receive(int destination) {
    List<SettableFuture<?>> wake = new ArrayList<>(1);
    ExchangeFrame frame = null;
    synchronized (this) {
      Preconditions.checkElementIndex(destination, receiverCount, "destination");
      for (int i = 0; i < senderCount && frame == null; i++) {
        int source = (nextSource[destination] + i) % senderCount;
        frame = take(channels[source][destination], wake);
        if (frame != null) {
          nextSource[destination] = (source + 1) % senderCount;
        }
      }
    }
    wake.forEach(LocalExchangeTransport::complete);
    return frame;
  }

  @Override
  public ExchangeFrame receive(int destination, int source) {
    List<SettableFuture<?>> wake = new ArrayList<>(1);
    ExchangeFrame frame;
    synchronized (this) {
      frame = take(channel(source, destination), wake);
    }
    wake.forEach(LocalExchangeTransport::complete);
    return frame;
  }

  @Override
  public synchronized ListenableFuture<?> whenReadable(int destination) {
    Preconditions.checkElementIndex(destination, receiverCount, "destination");
    for (int source = 0; source < senderCount; source++) {
      if (!channels[source][destination].frames.isEmpty()) {
        return Futures.immediateVoidFuture();
      }
    }
    if (readable[destination] == null) {
      readable[destination] = SettableFuture.create();
    }
    return readable[destination];
  }

  @Override
  public synchronized ListenableFuture<?> whenReadable(int destination, int source) {
    Channel channel = channel(source, destination);
    if (!channel.frames.isEmpty()) {
      return Futures.immediateVoidFuture();
    }
    if (channel.readable == null) {
      channel.readable = SettableFuture.create();
    }
    return channel.readable;
  }

  @Override
  public void abort(int destination) {
    List<SettableFuture<?>> wake = new ArrayList<>();
    synchronized (this) {
      Preconditions.checkElementIndex(destination, receiverCount, "destination");
      if (aborted[destination]) {
        return;
      }
      aborted[destination] = true;
      for (int source = 0; source < senderCount; source++) {
        Channel channel = channels[source][destination];
        channel.frames.clear();
        channel.dataFrames = 0;
        if (channel.writable != null) {
          wake.add(channel.writable);
          channel.writable = null;
        }
        if (channel.readable != null) {
          wake.add(channel.readable);
          channel.readable = null;
        }
      }
      if (readable[destination] != null) {
        wake.add(readable[destination]);
        readable[destination] = null;
      }
    }
    wake.forEach(LocalExchangeTransport::complete);
  }

  @Override
  public synchronized boolean isAborted(int destination) {
    Preconditions.checkElementIndex(destination, receiverCount, "destination");
    return aborted[destination];
  }

  /** Returns the number of frames waiting in every channel together. */
  public synchronized int getQueuedFrameCount() {
    int count = 0;
    for (Channel[] row : channels) {
      for (Channel channel : row) {
        count += channel.frames.size();
      }
    }
    return count;
  }

  private ExchangeFrame take(Channel channel, List<SettableFuture<?>> wake) {
    ExchangeFrame frame = channel.frames.poll();
    if (frame != null && !frame.isEnd()) {
      channel.dataFrames--;
      if (channel.writable != null) {
        wake.add(channel.writable);
        channel.writable = null;
      }
    }
    return frame;
  }

  private Channel channel(int source, int destination) {
    Preconditions.checkElementIndex(source, senderCount, "source");
    Preconditions.checkElementIndex(destination, receiverCount, "destination");
    return channels[source][destination];
  }

  private static void complete(SettableFuture<?> future) {
    if (future != null) {
      future.set(null);
    }
  }

  private static final class Channel {
    private final ArrayDeque<ExchangeFrame> frames = new ArrayDeque<>();
    private int dataFrames;
    private SettableFuture<?> writable;
    private SettableFuture<?> readable;
  }
}
