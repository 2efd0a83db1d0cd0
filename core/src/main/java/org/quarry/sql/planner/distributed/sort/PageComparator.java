/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.sort;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.Values;

/** Orders rows of pages with the same schema by a list of sort keys. */
public class PageComparator {

  private final List<SortKey> sortKeys;

  public PageComparator(List<SortKey> sortKeys) {
    this.sortKeys = ImmutableList.copyOf(sortKeys);
  }

  public List<SortKey> getSortKeys() {
    return sortKeys;
  }

  /**
   * Compares row {@code leftPosition} of {@code left} with row {@code rightPosition} of {@code
   * right}.
   */
  public int compare(Page left, int leftPosition, Page right, int rightPosition) {
    for (SortKey key : sortKeys) {
      Object leftValue = left.getValue(leftPosition, key.fieldIndex());
      Object rightValue = right.getValue(rightPosition, key.fieldIndex());
      int comparison;
      if (leftValue == null || rightValue == null) {
        // Null placement is independent of the direction.
        comparison = Values.compareNullable(leftValue, rightValue, key.nullsLast());
      } else {
        comparison = Values.compare(leftValue, rightValue);
        if (key.descending()) {
          comparison = -comparison;
        }
      }
      if (comparison != 0) {
        return comparison;
      }
    }
    return 0;
  }
}
