/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.port;

import com.google.common.base.Preconditions;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.processor.Processor;

/**
 * Single-slot directed edge between a producer and a consumer processor. The slot holds at most
 * one page in flight, which is the only admission control of the engine: a producer may not push
 * while the slot is full.
 *
 * <p>The port is owned by the {@link org.quarry.sql.planner.distributed.pipeline.Pipeline} and
 * referenced by both processors. One producer thread and one consumer thread may touch it at the
 * same time; every field is an atomic or volatile cell written by one side only, except the slot,
 * which moves by compare-and-set.
 *
 * <p>Every producer action flags the consumer side and every consumer action flags the producer
 * side. The scheduler drains those flags after running a processor to decide which peers to wake.
 */
public final class Port {

  private final int id;
  private Processor producer;
  private Processor consumer;

  private final AtomicReference<Page> slot = new AtomicReference<>();
  private volatile boolean needData;
  private volatile boolean finished;
  private volatile boolean closed;
  private volatile Throwable error;

  private final AtomicBoolean consumerSignal = new AtomicBoolean();
  private final AtomicBoolean producerSignal = new AtomicBoolean();

  public Port(int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  /** Binds both ends. Called once by the pipeline when connecting processors. */
  public void bind(Processor producer, Processor consumer) {
    Preconditions.checkState(this.producer == null, "Port %s is already bound", id);
    this.producer = Preconditions.checkNotNull(producer, "producer");
    this.consumer = Preconditions.checkNotNull(consumer, "consumer");
  }

  public Processor getProducer() {
    return producer;
  }

  public Processor getConsumer() {
    return consumer;
  }

  public boolean isBound() {
    return producer != null;
  }

  // ---- producer side ----

  /** Returns true if the slot is empty and neither side has finished the port. */
  public boolean canPush() {
    return slot.get() == null && !finished && !closed;
  }

  /**
   * Hands a page to the consumer. A page pushed after the consumer closed the port is dropped,
   * since the consumer has declared it will never read again.
   *
   * @throws IllegalStateException if the slot is full or the port is finished
   */
  public void push(Page page) {
    Preconditions.checkNotNull(page, "page");
    Preconditions.checkState(!finished, "Push to finished port %s", id);
    if (closed) {
      return;
    }
    Preconditions.checkState(slot.compareAndSet(null, page), "Push to full port %s", id);
    needData = false;
    consumerSignal.set(true);
  }

  /** Declares that no more pages will be pushed. Idempotent. */
  public void finish() {
    if (!finished) {
      finished = true;
      consumerSignal.set(true);
    }
  }

  /** Finishes the port with an attached error. */
  public void fail(Throwable cause) {
    if (error == null) {
      error = cause;
    }
    finish();
  }

  /** Returns true once the consumer has closed the port and will not read from it again. */
  public boolean isClosed() {
    return closed;
  }

  /** Returns true if the consumer asked for data and nothing was pushed since. */
  public boolean isNeedData() {
    return needData && !closed;
  }

  /** Returns true if the producer has finished this port (drained or not). */
  public boolean isProducerFinished() {
    return finished;
  }

  // ---- consumer side ----

  /** Returns true if a page is waiting in the slot. */
  public boolean hasData() {
    return slot.get() != null;
  }

  /** Takes the waiting page, or returns null if the slot is empty. */
  public Page pull() {
    Page page = slot.getAndSet(null);
    if (page != null) {
      producerSignal.set(true);
    }
    return page;
  }

  /** Asks the producer for data. */
  public void setNeedData() {
    if (!needData && !closed) {
      needData = true;
      producerSignal.set(true);
    }
  }

  public void setNotNeedData() {
    needData = false;
  }

  /**
   * Returns true if nothing more will ever be read from this port: the producer finished and the
   * slot is drained, or the consumer closed it.
   */
  public boolean isFinished() {
    return closed || (finished && slot.get() == null);
  }

  /** Consumer side shutdown: drops any waiting page and tells the producer to stop. Idempotent. */
  public void close() {
    if (!closed) {
      closed = true;
      needData = false;
      slot.set(null);
      producerSignal.set(true);
    }
  }

  /** Returns the error attached by a failed producer, or null. */
  public Throwable getError() {
    return error;
  }

  // ---- scheduler notifications ----

  /** Returns and clears the flag raised by producer actions since the last call. */
  public boolean takeConsumerSignal() {
    return consumerSignal.getAndSet(false);
  }

  /** Returns and clears the flag raised by consumer actions since the last call. */
  public boolean takeProducerSignal() {
    return producerSignal.getAndSet(false);
  }

  @Override
  public String toString() {
    return "Port{id="
        + id
        + ", hasData="
        + hasData()
        + ", needData="
        + needData
        + ", finished="
        + finished
        + ", closed="
        + closed
        + '}';
  }
}
