/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import org.quarry.sql.planner.distributed.page.Page;

/** Sends whole pages to the destinations in turn. */
public class RoundRobinPartitioner implements Partitioner {

  private final int destinationCount;
  private int next;

  public RoundRobinPartitioner(int destinationCount) {
    this.destinationCount = destinationCount;
  }

  @Override
  public Page[] partition(Page page) {
    Page[] result = new Page[destinationCount];
    result[next] = page;
    next = (next + 1) % destinationCount;
    return result;
  }
}
