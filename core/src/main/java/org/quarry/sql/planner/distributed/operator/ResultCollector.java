/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.quarry.sql.planner.distributed.page.Page;

/**
 * Collects pages from the result sink into a list of rows, which the coordinator hands to the
 * client once the query finished.
 */
public class ResultCollector {

  private final List<String> fieldNames;
  private final List<List<Object>> rows;

  public ResultCollector(List<String> fieldNames) {
    this.fieldNames = List.copyOf(fieldNames);
    this.rows = Collections.synchronizedList(new ArrayList<>());
  }

  /** Extracts rows from a page and adds them to the collected results. */
  public void addPage(Page page) {
    if (page == null) {
      return;
    }
    int channelCount = page.getChannelCount();
    for (int pos = 0; pos < page.getPositionCount(); pos++) {
      List<Object> row = new ArrayList<>(channelCount);
      for (int ch = 0; ch < channelCount; ch++) {
        row.add(page.getValue(pos, ch));
      }
      rows.add(Collections.unmodifiableList(row));
    }
  }

  /** Returns the field names for the collected data. */
  public List<String> getFieldNames() {
    return fieldNames;
  }

  /** Returns a snapshot of the collected rows. */
  public List<List<Object>> getRows() {
    synchronized (rows) {
      return List.copyOf(rows);
    }
  }

  public int getRowCount() {
    return rows.size();
  }
}
