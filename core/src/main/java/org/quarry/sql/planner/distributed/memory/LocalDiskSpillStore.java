/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.memory;

import com.google.common.base.Preconditions;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.log4j.Log4j2;

/**
 * {@link SpillStore} writing length-prefixed chunks to files under a local directory. Closing a
 * spill file also closes the readers still open on it.
 */
@Log4j2
public class LocalDiskSpillStore implements SpillStore {

  private final Path directory;
  private final AtomicLong spilledBytes = new AtomicLong();
  private final AtomicLong sequence = new AtomicLong();
  private final AtomicInteger openReaders = new AtomicInteger();

  public LocalDiskSpillStore(Path directory) {
    this.directory = directory;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create spill directory " + directory, e);
    }
  }

  @Override
  public SpillFile create(String owner) {
    String safeOwner = owner.replaceAll("[^A-Za-z0-9_.-]", "_");
    Path path = directory.resolve(safeOwner + "-" + sequence.incrementAndGet() + ".spill");
    return new DiskSpillFile(path);
  }

  @Override
  public long getSpilledBytes() {
    return spilledBytes.get();
  }

  /** Returns the number of chunk readers whose stream is still open. */
  public int getOpenReaderCount() {
    return openReaders.get();
  }

  private class DiskSpillFile implements SpillFile {
    private final Path path;
    private final List<ChunkIterator> readers = new ArrayList<>();
    private DataOutputStream out;
    private int chunkCount;
    private boolean closed;

    DiskSpillFile(Path path) {
      this.path = path;
      try {
        this.out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(path)));
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot create spill file " + path, e);
      }
    }

    @Override
    public void write(byte[] chunk) {
      Preconditions.checkState(out != null, "spill file %s is no longer writable", path);
      try {
        out.writeInt(chunk.length);
        out.write(chunk);
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot write spill file " + path, e);
      }
      chunkCount++;
      spilledBytes.addAndGet(chunk.length);
    }

    @Override
    public Iterator<byte[]> read() {
      Preconditions.checkState(!closed, "spill file %s closed", path);
      try {
        if (out != null) {
          out.close();
          out = null;
        }
        DataInputStream in =
            new DataInputStream(new BufferedInputStream(Files.newInputStream(path)));
        ChunkIterator reader = new ChunkIterator(path, in, chunkCount);
        readers.add(reader);
        return reader;
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot read spill file " + path, e);
      }
    }

    @Override
    public int getChunkCount() {
      return chunkCount;
    }

    @Override
    public void close() {
      if (closed) {
        return;
      }
      closed = true;
      for (ChunkIterator reader : readers) {
        reader.close();
      }
      readers.clear();
      try {
        if (out != null) {
          out.close();
        }
        Files.deleteIfExists(path);
      } catch (IOException e) {
        log.warn("Failed to delete spill file {}", path, e);
      }
    }
  }

  private class ChunkIterator implements Iterator<byte[]> {
    private final Path path;
    private final DataInputStream in;
    private int remaining;
    private boolean closed;

    ChunkIterator(Path path, DataInputStream in, int chunkCount) {
      this.path = path;
      this.in = in;
      this.remaining = chunkCount;
      openReaders.incrementAndGet();
    }

    @Override
    public boolean hasNext() {
      return remaining > 0;
    }

    @Override
    public byte[] next() {
      if (remaining <= 0) {
        throw new NoSuchElementException();
      }
      try {
        byte[] chunk = new byte[in.readInt()];
        in.readFully(chunk);
        remaining--;
        if (remaining == 0) {
          close();
        }
        return chunk;
      } catch (EOFException e) {
        throw new IllegalStateException("Spill file ended early", e);
      } catch (IOException e) {
        throw new UncheckedIOException("Cannot read spill chunk", e);
      }
    }

    void close() {
      if (closed) {
        return;
      }
      closed = true;
      remaining = 0;
      openReaders.decrementAndGet();
      try {
        in.close();
      } catch (IOException e) {
        log.warn("Failed to close reader of spill file {}", path, e);
      }
    }
  }
}
