/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import org.quarry.sql.planner.distributed.page.Page;

/** Routes the rows of a page to exchange destinations. */
public interface Partitioner {

  /**
   * Splits a page by destination.
   *
   * @return an array indexed by destination holding the page for that destination, or null where
   *     a destination receives nothing
   */
  Page[] partition(Page page);
}
