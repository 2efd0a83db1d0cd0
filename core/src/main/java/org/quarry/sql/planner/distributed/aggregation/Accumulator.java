/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.aggregation;

/**
 * Running state of one aggregate call for one group. The state can be exported as a fixed number
 * of intermediate values so partial and final aggregation may run on different lanes.
 */
public interface Accumulator {

  /** Folds one raw input value in. Nulls are ignored, except by COUNT(*). */
  void addInput(Object value);

  /** Merges intermediate values produced by {@link #writeIntermediate(Object[], int)}. */
  void addIntermediate(Object[] row, int offset);

  /** Writes the intermediate values into {@code row} starting at {@code offset}. */
  void writeIntermediate(Object[] row, int offset);

  /** Returns the final aggregate value. */
  Object evaluateFinal();
}
