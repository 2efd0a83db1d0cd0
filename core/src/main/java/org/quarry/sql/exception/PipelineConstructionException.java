/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.exception;

/**
 * The physical plan could not be turned into a pipeline: malformed or cyclic plan, unsupported
 * partitioning scheme, missing parameters. Raised before any processor is scheduled.
 */
public class PipelineConstructionException extends QueryEngineException {

  public PipelineConstructionException(String message) {
    super(message);
  }

  public PipelineConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}
