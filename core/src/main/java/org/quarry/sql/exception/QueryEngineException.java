/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.exception;

/** Root of the query engine exceptions. */
public class QueryEngineException extends RuntimeException {

  public QueryEngineException(String message) {
    super(message);
  }

  public QueryEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
