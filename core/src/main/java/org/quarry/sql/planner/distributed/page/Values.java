/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.page;

import java.util.Arrays;
import lombok.experimental.UtilityClass;

/** Comparison helpers for the scalar values held by blocks. */
@UtilityClass
public class Values {

  /** Returns true for Integer and Long values. */
  public static boolean isIntegral(Object value) {
    return value instanceof Integer || value instanceof Long;
  }

  /**
   * Compares two non-null values. Numbers compare numerically across types; strings, booleans and
   * byte arrays compare only with their own kind.
   *
   * @throws IllegalArgumentException if the values cannot be compared
   */
  public static int compare(Object left, Object right) {
    if (left instanceof Number && right instanceof Number) {
      if (isIntegral(left) && isIntegral(right)) {
        return Long.compare(((Number) left).longValue(), ((Number) right).longValue());
      }
      return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
    }
    if (left instanceof String && right instanceof String) {
      return ((String) left).compareTo((String) right);
    }
    if (left instanceof Boolean && right instanceof Boolean) {
      return Boolean.compare((Boolean) left, (Boolean) right);
    }
    if (left instanceof byte[] && right instanceof byte[]) {
      return Arrays.compareUnsigned((byte[]) left, (byte[]) right);
    }
    throw new IllegalArgumentException(
        "Cannot compare "
            + left.getClass().getSimpleName()
            + " with "
            + right.getClass().getSimpleName());
  }

  /** Compares two nullable values, ordering nulls first or last. */
  public static int compareNullable(Object left, Object right, boolean nullsLast) {
    if (left == null || right == null) {
      if (left == right) {
        return 0;
      }
      return (left == null) == nullsLast ? 1 : -1;
    }
    return compare(left, right);
  }
}
