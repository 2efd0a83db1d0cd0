/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.expression;

import org.quarry.sql.exception.QueryEngineException;

/** An expression could not be evaluated for a row. */
public class ExpressionEvaluationException extends QueryEngineException {

  public ExpressionEvaluationException(String message) {
    super(message);
  }

  public ExpressionEvaluationException(String message, Throwable cause) {
    super(message, cause);
  }
}
