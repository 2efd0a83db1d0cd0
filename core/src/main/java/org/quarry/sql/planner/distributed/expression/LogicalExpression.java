/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Page;

/** AND, OR and NOT with SQL three-valued logic. */
@Getter
public class LogicalExpression implements Expression {

  /** Logical operators. */
  public enum Operator {
    AND,
    OR,
    NOT
  }

  private final Operator operator;
  private final List<Expression> operands;

  public LogicalExpression(Operator operator, List<Expression> operands) {
    Preconditions.checkArgument(
        operator == Operator.NOT ? operands.size() == 1 : operands.size() >= 2,
        "Wrong operand count %s for %s",
        operands.size(),
        operator);
    for (Expression operand : operands) {
      Preconditions.checkArgument(
          operand.getType() == BlockType.BOOLEAN,
          "%s operand %s is not boolean",
          operator,
          operand);
    }
    this.operator = operator;
    this.operands = ImmutableList.copyOf(operands);
  }

  @Override
  public Object evaluate(Page page, int position) {
    if (operator == Operator.NOT) {
      Boolean value = asBoolean(operands.get(0).evaluate(page, position));
      return value == null ? null : !value;
    }
    boolean sawNull = false;
    boolean shortCircuit = operator == Operator.OR;
    for (Expression operand : operands) {
      Boolean value = asBoolean(operand.evaluate(page, position));
      if (value == null) {
        sawNull = true;
      } else if (value == shortCircuit) {
        return shortCircuit;
      }
    }
    return sawNull ? null : !shortCircuit;
  }

  private Boolean asBoolean(Object value) {
    if (value == null || value instanceof Boolean) {
      return (Boolean) value;
    }
    throw new ExpressionEvaluationException(
        operator + " operand evaluated to " + value.getClass().getSimpleName());
  }

  @Override
  public BlockType getType() {
    return BlockType.BOOLEAN;
  }

  @Override
  public String toString() {
    if (operator == Operator.NOT) {
      return "NOT " + operands.get(0);
    }
    return operands.stream()
        .map(Object::toString)
        .collect(Collectors.joining(" " + operator + " ", "(", ")"));
  }
}
