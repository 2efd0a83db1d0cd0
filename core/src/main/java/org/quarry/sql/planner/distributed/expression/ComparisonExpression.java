/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Page;
import org.quarry.sql.planner.distributed.page.Values;

/** Binary comparison with SQL null semantics: any null operand yields null. */
@Getter
@RequiredArgsConstructor
public class ComparisonExpression implements Expression {

  /** Comparison operators. */
  @RequiredArgsConstructor
  public enum Operator {
    EQUAL("="),
    NOT_EQUAL("<>"),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">=");

    @Getter private final String symbol;

    boolean test(int comparison) {
      switch (this) {
        case EQUAL:
          return comparison == 0;
        case NOT_EQUAL:
          return comparison != 0;
        case LESS_THAN:
          return comparison < 0;
        case LESS_THAN_OR_EQUAL:
          return comparison <= 0;
        case GREATER_THAN:
          return comparison > 0;
        default:
          return comparison >= 0;
      }
    }
  }

  private final Operator operator;
  private final Expression left;
  private final Expression right;

  @Override
  public Object evaluate(Page page, int position) {
    Object leftValue = left.evaluate(page, position);
    Object rightValue = right.evaluate(page, position);
    if (leftValue == null || rightValue == null) {
      return null;
    }
    try {
      return operator.test(Values.compare(leftValue, rightValue));
    } catch (IllegalArgumentException e) {
      throw new ExpressionEvaluationException("Type mismatch in " + this, e);
    }
  }

  @Override
  public BlockType getType() {
    return BlockType.BOOLEAN;
  }

  @Override
  public boolean isNullable() {
    return left.isNullable() || right.isNullable();
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getSymbol() + " " + right + ")";
  }
}
