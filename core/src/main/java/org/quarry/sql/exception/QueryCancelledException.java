/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.exception;

import lombok.Getter;

/**
 * The query was stopped on request. Kept apart from {@link ProcessorException} so callers can tell
 * a cancelled query from a broken one.
 */
public class QueryCancelledException extends QueryEngineException {

  /** Why the query was cancelled. */
  public enum Reason {
    USER,
    TIMEOUT
  }

  @Getter private final Reason reason;

  public QueryCancelledException(Reason reason) {
    super(reason == Reason.TIMEOUT ? "Query timed out" : "Query was cancelled");
    this.reason = reason;
  }
}
