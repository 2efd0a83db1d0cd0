/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.quarry.sql.planner.distributed.page.Page;

/**
 * Routes each row to {@code murmur3(key) mod destinations}. The hash only depends on the key
 * values, so routing is the same on every sender and in every run.
 */
public class HashPartitioner implements Partitioner {

  private static final HashFunction HASH = Hashing.murmur3_32_fixed();

  private final List<Integer> hashChannels;
  private final int destinationCount;

  public HashPartitioner(List<Integer> hashChannels, int destinationCount) {
    this.hashChannels = ImmutableList.copyOf(hashChannels);
    this.destinationCount = destinationCount;
  }

  @Override
  public Page[] partition(Page page) {
    int rows = page.getPositionCount();
    int[][] positions = new int[destinationCount][rows];
    int[] counts = new int[destinationCount];
    for (int position = 0; position < rows; position++) {
      int destination = destinationOf(page, position);
      positions[destination][counts[destination]++] = position;
    }
    Page[] result = new Page[destinationCount];
    for (int destination = 0; destination < destinationCount; destination++) {
      if (counts[destination] == rows) {
        result[destination] = page;
      } else if (counts[destination] > 0) {
        result[destination] = page.selectPositions(positions[destination], counts[destination]);
      }
    }
    return result;
  }

  /** Returns the destination of one row. */
  public int destinationOf(Page page, int position) {
    Hasher hasher = HASH.newHasher();
    for (int channel : hashChannels) {
      putValue(hasher, page.getValue(position, channel));
    }
    return Math.floorMod(hasher.hash().asInt(), destinationCount);
  }

  private static void putValue(Hasher hasher, Object value) {
    if (value == null) {
      hasher.putByte((byte) 0);
      return;
    }
    hasher.putByte((byte) 1);
    if (value instanceof Integer) {
      hasher.putInt((Integer) value);
    } else if (value instanceof Long) {
      hasher.putLong((Long) value);
    } else if (value instanceof Double) {
      hasher.putDouble((Double) value);
    } else if (value instanceof Float) {
      hasher.putFloat((Float) value);
    } else if (value instanceof Boolean) {
      hasher.putBoolean((Boolean) value);
    } else if (value instanceof byte[]) {
      hasher.putBytes((byte[]) value);
    } else {
      hasher.putString(value.toString(), StandardCharsets.UTF_8);
    }
  }
}
