/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.exception;

import lombok.Getter;

/** A named processor failed while executing. Terminal for the pipeline that owns it. */
public class ProcessorException extends QueryEngineException {

  @Getter private final String processorName;

  public ProcessorException(String processorName, String message) {
    super(format(processorName, message));
    this.processorName = processorName;
  }

  public ProcessorException(String processorName, String message, Throwable cause) {
    super(format(processorName, message), cause);
    this.processorName = processorName;
  }

  private static String format(String processorName, String message) {
    return "Processor [" + processorName + "] failed: " + message;
  }
}
