/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.operator;

import com.google.common.base.Preconditions;
import org.quarry.sql.planner.distributed.expression.Expression;
import org.quarry.sql.planner.distributed.expression.ExpressionEvaluationException;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.processor.ProcessorContext;
import org.quarry.sql.planner.distributed.processor.TransformProcessor;

/** Keeps the rows for which the predicate is true. Null counts as false. */
public class FilterProcessor extends TransformProcessor {

  private final Expression predicate;

  public FilterProcessor(ProcessorContext context, Expression predicate) {
    super(context);
    Preconditions.checkArgument(
        predicate.getType() == BlockType.BOOLEAN,
        "Filter predicate %s is %s, not BOOLEAN",
        predicate,
        predicate.getType());
    this.predicate = predicate;
  }

  @Override
  protected Page process(Page page) {
    int rows = page.getPositionCount();
    int[] selected = new int[rows];
    int count = 0;
    for (int position = 0; position < rows; position++) {
      Object value = predicate.evaluate(page, position);
      if (value != null && !(value instanceof Boolean)) {
        throw new ExpressionEvaluationException(
            "Predicate " + predicate + " evaluated to " + value.getClass().getSimpleName());
      }
      if (Boolean.TRUE.equals(value)) {
        selected[count++] = position;
      }
    }
    if (count == rows) {
      return page;
    }
    return count == 0 ? null : page.selectPositions(selected, count);
  }
}
