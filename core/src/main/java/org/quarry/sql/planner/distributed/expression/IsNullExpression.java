/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Page;

/** IS NULL, or IS NOT NULL when negated. Never null itself. */
@Getter
@RequiredArgsConstructor
public class IsNullExpression implements Expression {

  private final Expression operand;
  private final boolean negated;

  @Override
  public Object evaluate(Page page, int position) {
    boolean isNull = operand.evaluate(page, position) == null;
    return negated != isNull;
  }

  @Override
  public BlockType getType() {
    return BlockType.BOOLEAN;
  }

  @Override
  public boolean isNullable() {
    return false;
  }

  @Override
  public String toString() {
    return operand + (negated ? " IS NOT NULL" : " IS NULL");
  }
}
