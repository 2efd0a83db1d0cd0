/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.memory;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link SpillStore} keeping chunks on the heap. Spilled pages still leave the owning processor's
 * memory accounting, so this store suits tests and small deployments.
 */
public class InMemorySpillStore implements SpillStore {

  private final AtomicLong spilledBytes = new AtomicLong();
  private final AtomicLong openFiles = new AtomicLong();

  @Override
  public SpillFile create(String owner) {
    openFiles.incrementAndGet();
    return new MemorySpillFile();
  }

  @Override
  public long getSpilledBytes() {
    return spilledBytes.get();
  }

  /** Returns the number of files created and not closed yet. */
  public long getOpenFileCount() {
    return openFiles.get();
  }

  private class MemorySpillFile implements SpillFile {
    private final List<byte[]> chunks = new ArrayList<>();
    private boolean closed;

    @Override
    public void write(byte[] chunk) {
      Preconditions.checkState(!closed, "spill file closed");
      chunks.add(chunk);
      spilledBytes.addAndGet(chunk.length);
    }

    @Override
    public Iterator<byte[]> read() {
      Preconditions.checkState(!closed, "spill file closed");
      return chunks.iterator();
    }

    @Override
    public int getChunkCount() {
      return chunks.size();
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        chunks.clear();
        openFiles.decrementAndGet();
      }
    }
  }
}
