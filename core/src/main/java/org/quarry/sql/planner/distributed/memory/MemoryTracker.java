/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.memory;

import com.google.common.base.Preconditions;
import org.quarry.sql.exception.ResourceExhaustedException;

/**
 * Tracks the bytes a single processor holds in its own buffers (hash tables, sort buffers) against
 * the processor's memory limit. Used only by the worker that owns the processor.
 */
public class MemoryTracker {

  private final String owner;
  private final long limitBytes;
  private long reservedBytes;
  private long peakBytes;

  public MemoryTracker(String owner, long limitBytes) {
    Preconditions.checkArgument(limitBytes > 0, "memory limit must be positive: %s", limitBytes);
    this.owner = owner;
    this.limitBytes = limitBytes;
  }

  /** Reserves the bytes if they fit under the limit. */
  public boolean tryReserve(long bytes) {
    Preconditions.checkArgument(bytes >= 0, "negative reservation: %s", bytes);
    if (reservedBytes + bytes > limitBytes) {
      return false;
    }
    reservedBytes += bytes;
    peakBytes = Math.max(peakBytes, reservedBytes);
    return true;
  }

  /**
   * Reserves the bytes.
   *
   * @throws ResourceExhaustedException if they do not fit under the limit
   */
  public void reserve(long bytes) {
    if (!tryReserve(bytes)) {
      throw new ResourceExhaustedException(owner, reservedBytes + bytes, limitBytes);
    }
  }

  public void free(long bytes) {
    reservedBytes = Math.max(0, reservedBytes - bytes);
  }

  public void freeAll() {
    reservedBytes = 0;
  }

  public long getReservedBytes() {
    return reservedBytes;
  }

  public long getPeakBytes() {
    return peakBytes;
  }

  public long getLimitBytes() {
    return limitBytes;
  }
}
