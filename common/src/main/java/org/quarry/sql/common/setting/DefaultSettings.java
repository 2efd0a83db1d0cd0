/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.common.setting;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link Settings} backed by built-in defaults, overridden by an optional {@code quarry.properties}
 * classpath resource, overridden in turn by JVM system properties with the same key names.
 */
public class DefaultSettings extends Settings {

  private static final Logger LOG = LogManager.getLogger();

  public static final String RESOURCE_NAME = "quarry.properties";

  private final Map<Key, Object> values;

  @VisibleForTesting
  DefaultSettings(Properties overrides) {
    this.values = new EnumMap<>(Key.class);
    for (Key key : Key.values()) {
      Object defaultValue = defaultValue(key);
      String override = overrides.getProperty(key.getKeyValue());
      values.put(key, override == null ? defaultValue : parse(key, defaultValue, override.trim()));
    }
  }

  /** Loads settings from the classpath resource and system properties. */
  public static DefaultSettings load() {
    Properties properties = new Properties();
    try (InputStream in =
        DefaultSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
      if (in != null) {
        properties.load(in);
        LOG.debug("Loaded settings from classpath resource {}", RESOURCE_NAME);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + RESOURCE_NAME, e);
    }
    for (Key key : Key.values()) {
      String value = System.getProperty(key.getKeyValue());
      if (value != null) {
        properties.setProperty(key.getKeyValue(), value);
      }
    }
    return new DefaultSettings(properties);
  }

  /** Returns settings holding only the defaults plus the given overrides. */
  public static DefaultSettings of(Map<Key, ?> overrides) {
    Properties properties = new Properties();
    overrides.forEach((key, value) -> properties.setProperty(key.getKeyValue(), value.toString()));
    return new DefaultSettings(properties);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  @Override
  public List<?> getSettings() {
    return ImmutableList.copyOf(values.entrySet());
  }

  private static Object defaultValue(Key key) {
    int processors = Runtime.getRuntime().availableProcessors();
    switch (key) {
      case WORKER_THREADS:
      case DEFAULT_PARALLELISM:
        return processors;
      case WORKER_QUANTUM:
        return 64;
      case PAGE_SIZE_ROWS:
        return 1024;
      case EXCHANGE_CHANNEL_CAPACITY:
        return 4;
      case PROCESSOR_MEMORY_LIMIT_BYTES:
        return 256L * 1024 * 1024;
      case SORT_SPILL_ENABLED:
        return true;
      case QUERY_TIMEOUT_MILLIS:
        return 0L;
      case QUERY_MAX_RETRIES:
        return 0;
      default:
        throw new IllegalArgumentException("No default for setting " + key.getKeyValue());
    }
  }

  private static Object parse(Key key, Object defaultValue, String value) {
    try {
      if (defaultValue instanceof Integer) {
        int parsed = Integer.parseInt(value);
        if (parsed < 0) {
          throw new IllegalArgumentException(
              "Setting " + key.getKeyValue() + " must be non-negative: " + value);
        }
        return parsed;
      }
      if (defaultValue instanceof Long) {
        long parsed = Long.parseLong(value);
        if (parsed < 0) {
          throw new IllegalArgumentException(
              "Setting " + key.getKeyValue() + " must be non-negative: " + value);
        }
        return parsed;
      }
      if (defaultValue instanceof Boolean) {
        if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
          throw new IllegalArgumentException(
              "Setting " + key.getKeyValue() + " must be true or false: " + value);
        }
        return Boolean.parseBoolean(value);
      }
      return value;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "Setting " + key.getKeyValue() + " is not a valid number: " + value, e);
    }
  }
}
