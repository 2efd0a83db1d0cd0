/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.exception;

/** Transport or decode failure of an exchange endpoint. */
public class ExchangeException extends ProcessorException {

  public ExchangeException(String processorName, String message) {
    super(processorName, message);
  }

  public ExchangeException(String processorName, String message, Throwable cause) {
    super(processorName, message, cause);
  }
}
