/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Quarry engine settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Executor settings. */
    WORKER_THREADS("quarry.executor.worker_threads"),
    WORKER_QUANTUM("quarry.executor.worker_quantum"),

    /** Pipeline construction settings. */
    DEFAULT_PARALLELISM("quarry.pipeline.default_parallelism"),
    PAGE_SIZE_ROWS("quarry.pipeline.page_size_rows"),

    /** Exchange settings. */
    EXCHANGE_CHANNEL_CAPACITY("quarry.exchange.channel_capacity"),

    /** Memory and spill settings. */
    PROCESSOR_MEMORY_LIMIT_BYTES("quarry.processor.memory_limit_bytes"),
    SORT_SPILL_ENABLED("quarry.sort.spill_enabled"),

    /** Query settings. */
    QUERY_TIMEOUT_MILLIS("quarry.query.timeout_millis"),
    QUERY_MAX_RETRIES("quarry.query.max_retries");

    @Getter private final String keyValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = ImmutableMap.builder();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      String key = keyValue == null ? "" : keyValue.toLowerCase();
      return Optional.ofNullable(ALL_KEYS.getOrDefault(key, null));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  public abstract List<?> getSettings();
}
