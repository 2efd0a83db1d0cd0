/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.expression;

import java.util.List;
import lombok.experimental.UtilityClass;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.PageSchema;

/** Factory methods for building expressions in plans and tests. */
@UtilityClass
public class Expressions {

  /** References the named column of the schema. */
  public static ColumnReference column(PageSchema schema, String name) {
    int channel = schema.indexOf(name);
    return new ColumnReference(channel, name, schema.getColumn(channel).getType());
  }

  public static Literal literal(int value) {
    return new Literal(value, BlockType.INT);
  }

  public static Literal literal(long value) {
    return new Literal(value, BlockType.LONG);
  }

  public static Literal literal(double value) {
    return new Literal(value, BlockType.DOUBLE);
  }

  public static Literal literal(String value) {
    return new Literal(value, BlockType.STRING);
  }

  public static Literal literal(boolean value) {
    return new Literal(value, BlockType.BOOLEAN);
  }

  public static Expression compare(
      ComparisonExpression.Operator operator, Expression left, Expression right) {
    return new ComparisonExpression(operator, left, right);
  }

  public static Expression equal(Expression left, Expression right) {
    return compare(ComparisonExpression.Operator.EQUAL, left, right);
  }

  public static Expression greaterThan(Expression left, Expression right) {
    return compare(ComparisonExpression.Operator.GREATER_THAN, left, right);
  }

  public static Expression lessThan(Expression left, Expression right) {
    return compare(ComparisonExpression.Operator.LESS_THAN, left, right);
  }

  public static Expression add(Expression left, Expression right) {
    return new ArithmeticExpression(ArithmeticExpression.Operator.ADD, left, right);
  }

  public static Expression multiply(Expression left, Expression right) {
    return new ArithmeticExpression(ArithmeticExpression.Operator.MULTIPLY, left, right);
  }

  public static Expression divide(Expression left, Expression right) {
    return new ArithmeticExpression(ArithmeticExpression.Operator.DIVIDE, left, right);
  }

  public static Expression modulus(Expression left, Expression right) {
    return new ArithmeticExpression(ArithmeticExpression.Operator.MODULUS, left, right);
  }

  public static Expression and(Expression... operands) {
    return new LogicalExpression(LogicalExpression.Operator.AND, List.of(operands));
  }

  public static Expression or(Expression... operands) {
    return new LogicalExpression(LogicalExpression.Operator.OR, List.of(operands));
  }

  public static Expression not(Expression operand) {
    return new LogicalExpression(LogicalExpression.Operator.NOT, List.of(operand));
  }

  public static Expression isNull(Expression operand) {
    return new IsNullExpression(operand, false);
  }

  public static Expression isNotNull(Expression operand) {
    return new IsNullExpression(operand, true);
  }
}
