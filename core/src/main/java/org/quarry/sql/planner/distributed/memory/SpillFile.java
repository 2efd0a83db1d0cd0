/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.memory;

import java.util.Iterator;

/** An append-then-read sequence of opaque chunks in a {@link SpillStore}. */
public interface SpillFile extends AutoCloseable {

  /** Appends one chunk. Must not be called after {@link #read()}. */
  void write(byte[] chunk);

  /** Returns the chunks in write order. */
  Iterator<byte[]> read();

  /** Returns the number of chunks written. */
  int getChunkCount();

  /** Deletes the file. Idempotent. */
  @Override
  void close();
}
