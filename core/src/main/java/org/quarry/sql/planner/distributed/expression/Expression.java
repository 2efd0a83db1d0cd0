/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.expression;

import org.quarry.sql.planner.distributed.page.Block.BlockType;
import org.quarry.sql.planner.distributed.page.Page;

/** A scalar expression evaluated row by row against a page. */
public interface Expression {

  /**
   * Evaluates the expression for one row.
   *
   * @param page the input page
   * @param position the row index
   * @return the value, or null for SQL NULL
   * @throws ExpressionEvaluationException on type mismatch, overflow or division by zero
   */
  Object evaluate(Page page, int position);

  /** Returns the type of the values this expression produces. */
  BlockType getType();

  /** Returns true if the expression may produce nulls. */
  default boolean isNullable() {
    return true;
  }
}
