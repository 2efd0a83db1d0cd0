/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.memory;

/**
 * External staging area processors may spill to when their buffers outgrow their memory limit.
 * Implementations must allow different processors to use the store concurrently.
 */
public interface SpillStore {

  /**
   * Creates an empty spill file.
   *
   * @param owner name of the spilling processor, used in file names and diagnostics
   */
  SpillFile create(String owner);

  /** Returns the total number of bytes written to this store so far. */
  long getSpilledBytes();
}
