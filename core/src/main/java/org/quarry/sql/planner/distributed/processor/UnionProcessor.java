/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.processor;

import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.port.Port;

/**
 * Forwards pages from any input to the single output, taking inputs round-robin. Pages are moved
 * in {@link #poll()} alone; there is no per-page work to execute.
 */
public class UnionProcessor extends MultiInputProcessor {

  private int nextInput;

  public UnionProcessor(ProcessorContext context, int inputCount) {
    super(context, inputCount);
  }

  @Override
  protected ProcessorState pollInputs() {
    int count = inputCount();
    Port selected = null;
    boolean allFinished = true;
    for (int i = 0; i < count; i++) {
      int index = (nextInput + i) % count;
      Port port = input(index);
      if (port.isFinished()) {
        continue;
      }
      allFinished = false;
      if (selected == null && port.hasData()) {
        selected = port;
        nextInput = (index + 1) % count;
      } else {
        port.setNeedData();
      }
    }
    if (selected != null) {
      Page page = nonEmpty(pullFrom(selected));
      selected.setNeedData();
      if (page == null) {
        return ProcessorState.READY;
      }
      pushTo(output(0), page);
      return ProcessorState.NEED_CONSUME;
    }
    return allFinished ? finish() : ProcessorState.NEED_DATA;
  }
}
