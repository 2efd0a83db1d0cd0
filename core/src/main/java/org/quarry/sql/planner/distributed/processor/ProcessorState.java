/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

/** State a {@link Processor} reports from {@link Processor#poll()}. */
public enum ProcessorState {

  /** Waiting for a producer to push a page on an input port. */
  NEED_DATA,

  /** Waiting for a consumer to drain an output port. */
  NEED_CONSUME,

  /** Has synchronous work; the scheduler should call {@link Processor#execute()}. */
  READY,

  /** Waits on one external event; the scheduler should call {@link Processor#executeAsync()}. */
  ASYNC,

  /** Done; every output port is finished. */
  FINISHED,

  /** Failed; only the scheduler assigns this state. */
  FAILED;

  public boolean isTerminal() {
    return this == FINISHED || this == FAILED;
  }
}
