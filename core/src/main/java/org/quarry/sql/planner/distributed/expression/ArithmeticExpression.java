/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Page;

/**
 * Binary arithmetic on numeric operands. Integer arithmetic is exact: overflow and division by
 * zero fail the evaluation instead of wrapping.
 */
@Getter
public class ArithmeticExpression implements Expression {

  /** Arithmetic operators. */
  @RequiredArgsConstructor
  public enum Operator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    MODULUS("%");

    @Getter private final String symbol;
  }

  private final Operator operator;
  private final Expression left;
  private final Expression right;
  private final BlockType type;

  public ArithmeticExpression(Operator operator, Expression left, Expression right) {
    if (!left.getType().isNumeric() || !right.getType().isNumeric()) {
      throw new IllegalArgumentException(
          "Arithmetic " + operator.getSymbol() + " needs numeric operands, got "
              + left.getType() + " and " + right.getType());
    }
    this.operator = operator;
    this.left = left;
    this.right = right;
    this.type = resultType(left.getType(), right.getType());
  }

  private static BlockType resultType(BlockType left, BlockType right) {
    if (left == BlockType.DOUBLE || right == BlockType.DOUBLE
        || left == BlockType.FLOAT || right == BlockType.FLOAT) {
      return BlockType.DOUBLE;
    }
    if (left == BlockType.LONG || right == BlockType.LONG) {
      return BlockType.LONG;
    }
    return BlockType.INT;
  }

  @Override
  public Object evaluate(Page page, int position) {
    Object leftValue = left.evaluate(page, position);
    Object rightValue = right.evaluate(page, position);
    if (leftValue == null || rightValue == null) {
      return null;
    }
    if (!(leftValue instanceof Number) || !(rightValue instanceof Number)) {
      throw new ExpressionEvaluationException(
          "Type mismatch in " + this + ": " + leftValue.getClass().getSimpleName() + " "
              + operator.getSymbol() + " " + rightValue.getClass().getSimpleName());
    }
    Number l = (Number) leftValue;
    Number r = (Number) rightValue;
    try {
      switch (type) {
        case INT:
          return Math.toIntExact(apply(l.longValue(), r.longValue()));
        case LONG:
          return apply(l.longValue(), r.longValue());
        default:
          return apply(l.doubleValue(), r.doubleValue());
      }
    } catch (ArithmeticException e) {
      throw new ExpressionEvaluationException(
          "Arithmetic error evaluating " + this + ": " + e.getMessage(), e);
    }
  }

  private long apply(long l, long r) {
    switch (operator) {
      case ADD:
        return Math.addExact(l, r);
      case SUBTRACT:
        return Math.subtractExact(l, r);
      case MULTIPLY:
        return Math.multiplyExact(l, r);
      case DIVIDE:
        if (r == 0) {
          throw new ArithmeticException("division by zero");
        }
        if (l == Long.MIN_VALUE && r == -1) {
          throw new ArithmeticException("long overflow");
        }
        return l / r;
      default:
        if (r == 0) {
          throw new ArithmeticException("division by zero");
        }
        return l % r;
    }
  }

  private double apply(double l, double r) {
    switch (operator) {
      case ADD:
        return l + r;
      case SUBTRACT:
        return l - r;
      case MULTIPLY:
        return l * r;
      case DIVIDE:
        if (r == 0) {
          throw new ArithmeticException("division by zero");
        }
        return l / r;
      default:
        if (r == 0) {
          throw new ArithmeticException("division by zero");
        }
        return l % r;
    }
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getSymbol() + " " + right + ")";
  }
}
