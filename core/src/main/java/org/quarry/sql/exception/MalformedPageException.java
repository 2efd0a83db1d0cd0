/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.exception;

/** A page whose columns disagree on the row count or hold values of the wrong type. */
public class MalformedPageException extends QueryEngineException {

  public MalformedPageException(String message) {
    super(message);
  }

  public MalformedPageException(String message, Throwable cause) {
    super(message, cause);
  }
}
