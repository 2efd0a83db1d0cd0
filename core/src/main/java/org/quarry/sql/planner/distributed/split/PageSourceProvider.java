/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.split;

import java.util.List;
import org.quarry.sql.planner.distributed.page.PageSchema;

/** Storage-layer entry point used by pipeline construction to plan and open table scans. */
public interface PageSourceProvider {

  /**
   * Returns the schema of the given columns of a table, in the requested order. An empty column
   * list selects every column.
   *
   * @throws IllegalArgumentException if the table or a column does not exist
   */
  PageSchema getSchema(String table, List<String> columns);

  /** Returns the non-overlapping data units that together hold every row of the table. */
  List<DataUnit> getDataUnits(String table);

  /** Opens a reader over one data unit that produces the given columns. */
  PageSource createPageSource(DataUnit dataUnit, List<String> columns);
}
