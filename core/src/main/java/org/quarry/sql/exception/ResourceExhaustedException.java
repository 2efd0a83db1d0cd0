/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.exception;

import lombok.Getter;

/** A memory guard tripped in a processor that cannot spill. */
@Getter
public class ResourceExhaustedException extends QueryEngineException {

  private final String processorName;
  private final long requestedBytes;
  private final long limitBytes;

  public ResourceExhaustedException(String processorName, long requestedBytes, long limitBytes) {
    super(
        String.format(
            "Processor [%s] exceeded its memory limit: %d bytes requested, limit is %d bytes",
            processorName, requestedBytes, limitBytes));
    this.processorName = processorName;
    this.requestedBytes = requestedBytes;
    this.limitBytes = limitBytes;
  }
}
