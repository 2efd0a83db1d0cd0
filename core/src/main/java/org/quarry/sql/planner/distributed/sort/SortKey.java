/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.sort;

/** Represents a sort key with field name, channel, direction, and null ordering. */
public record SortKey(String fieldName, int fieldIndex, boolean descending, boolean nullsLast) {

  /** Ascending with nulls last. */
  public static SortKey ascending(String fieldName, int fieldIndex) {
    return new SortKey(fieldName, fieldIndex, false, true);
  }

  /** Descending with nulls first. */
  public static SortKey descending(String fieldName, int fieldIndex) {
    return new SortKey(fieldName, fieldIndex, true, false);
  }
}
