/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import org.quarry.sql.planner.distributed.page.Page;

/** Sends every page to every destination. */
@RequiredArgsConstructor
public class BroadcastPartitioner implements Partitioner {

  private final int destinationCount;

  @Override
  public Page[] partition(Page page) {
    Page[] result = new Page[destinationCount];
    Arrays.fill(result, page);
    return result;
  }
}
