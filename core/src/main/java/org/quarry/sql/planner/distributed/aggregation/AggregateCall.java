/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.aggregation;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** One aggregate in a GROUP BY: the function, its input channel and the output column name. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class AggregateCall {

  /** Input channel of COUNT(*), which counts rows rather than non-null values. */
  public static final int ALL_ROWS = -1;

  private final AggregateFunction function;
  private final int inputChannel;
  private final String outputName;

  public static AggregateCall of(AggregateFunction function, int inputChannel, String outputName) {
    return new AggregateCall(function, inputChannel, outputName);
  }

  public static AggregateCall countAll(String outputName) {
    return new AggregateCall(AggregateFunction.COUNT, ALL_ROWS, outputName);
  }

  public boolean isCountAll() {
    return inputChannel == ALL_ROWS;
  }

  @Override
  public String toString() {
    return function + "(" + (isCountAll() ? "*" : "#" + inputChannel) + ") AS " + outputName;
  }
}
