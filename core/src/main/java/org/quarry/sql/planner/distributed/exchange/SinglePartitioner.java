/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import org.quarry.sql.planner.distributed.page.Page;

/** Sends everything to destination 0, as the senders of a merge exchange do. */
public class SinglePartitioner implements Partitioner {

  @Override
  public Page[] partition(Page page) {
    return new Page[] {page};
  }
}
