/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.planner.distributed.exchange;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import lombok.EqualsAndHashCode;
import org.quarry.sql.exception.PipelineConstructionException;
import org.quarry.sql.planner.distributed.sort.SortKey;

/** Describes how an exchange partitions its senders' output across receivers. */
@EqualsAndHashCode
public class PartitioningScheme {

  private final ExchangeType exchangeType;
  private final List<Integer> hashChannels;
  private final List<SortKey> sortKeys;

  private PartitioningScheme(
      ExchangeType exchangeType, List<Integer> hashChannels, List<SortKey> sortKeys) {
    this.exchangeType = exchangeType;
    this.hashChannels = ImmutableList.copyOf(hashChannels);
    this.sortKeys = ImmutableList.copyOf(sortKeys);
  }

  /** Creates a HASH partitioning on the given column indices. */
  public static PartitioningScheme hash(List<Integer> hashChannels) {
    return new PartitioningScheme(ExchangeType.HASH, hashChannels, List.of());
  }

  /** Creates a BROADCAST partitioning (all data to all receivers). */
  public static PartitioningScheme broadcast() {
    return new PartitioningScheme(ExchangeType.BROADCAST, List.of(), List.of());
  }

  /** Creates a ROUND_ROBIN partitioning. */
  public static PartitioningScheme roundRobin() {
    return new PartitioningScheme(ExchangeType.ROUND_ROBIN, List.of(), List.of());
  }

  /** Creates a MERGE partitioning of streams sorted by the given keys. */
  public static PartitioningScheme merge(List<SortKey> sortKeys) {
    return new PartitioningScheme(ExchangeType.MERGE, List.of(), sortKeys);
  }

  /**
   * Resolves a scheme by name ({@code hash}, {@code broadcast}, {@code round_robin} or {@code
   * merge}, case-insensitive).
   *
   * @throws PipelineConstructionException for an unknown name
   */
  public static PartitioningScheme parse(
      String name, List<Integer> hashChannels, List<SortKey> sortKeys) {
    ExchangeType type;
    try {
      type = ExchangeType.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new PipelineConstructionException("Unsupported partitioning scheme: " + name, e);
    }
    return new PartitioningScheme(type, hashChannels, sortKeys);
  }

  /**
   * Checks the scheme can route to the given number of receivers.
   *
   * @throws PipelineConstructionException if the parameters are invalid
   */
  public void validate(int destinationCount, int channelCount) {
    if (destinationCount < 1) {
      throw new PipelineConstructionException(
          "Exchange needs at least one destination, got " + destinationCount);
    }
    switch (exchangeType) {
      case HASH:
        if (hashChannels.isEmpty()) {
          throw new PipelineConstructionException("Hash partitioning needs at least one column");
        }
        for (int channel : hashChannels) {
          if (channel < 0 || channel >= channelCount) {
            throw new PipelineConstructionException(
                "Hash column " + channel + " out of range [0, " + channelCount + ")");
          }
        }
        break;
      case MERGE:
        if (destinationCount != 1) {
          throw new PipelineConstructionException(
              "Merge partitioning needs exactly one destination, got " + destinationCount);
        }
        for (SortKey key : sortKeys) {
          if (key.fieldIndex() < 0 || key.fieldIndex() >= channelCount) {
            throw new PipelineConstructionException(
                "Sort key " + key.fieldName() + " out of range [0, " + channelCount + ")");
          }
        }
        break;
      default:
        break;
    }
  }

  /** Creates the partitioner a sender uses to route pages to {@code destinationCount} receivers. */
  public Partitioner createPartitioner(int destinationCount) {
    switch (exchangeType) {
      case HASH:
        return new HashPartitioner(hashChannels, destinationCount);
      case BROADCAST:
        return new BroadcastPartitioner(destinationCount);
      case ROUND_ROBIN:
        return new RoundRobinPartitioner(destinationCount);
      default:
        return new SinglePartitioner();
    }
  }

  public ExchangeType getExchangeType() {
    return exchangeType;
  }

  /** Returns the column indices used for hash partitioning. Empty for non-hash schemes. */
  public List<Integer> getHashChannels() {
    return hashChannels;
  }

  /** Returns the sort keys of a MERGE exchange. Empty for other schemes. */
  public List<SortKey> getSortKeys() {
    return sortKeys;
  }

  @Override
  public String toString() {
    return exchangeType + (hashChannels.isEmpty() ? "" : hashChannels.toString());
  }
}
