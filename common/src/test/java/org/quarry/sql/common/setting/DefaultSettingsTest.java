/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DefaultSettingsTest {

  @Test
  void should_return_defaults_when_nothing_is_overridden() {
    DefaultSettings settings = new DefaultSettings(new Properties());

    assertEquals(64, (int) settings.getSettingValue(Settings.Key.WORKER_QUANTUM));
    assertEquals(4, (int) settings.getSettingValue(Settings.Key.EXCHANGE_CHANNEL_CAPACITY));
    assertEquals(0L, (long) settings.getSettingValue(Settings.Key.QUERY_TIMEOUT_MILLIS));
    assertTrue(settings.<Boolean>getSettingValue(Settings.Key.SORT_SPILL_ENABLED));
    assertEquals(
        Runtime.getRuntime().availableProcessors(),
        (int) settings.getSettingValue(Settings.Key.WORKER_THREADS));
  }

  @Test
  void should_apply_typed_overrides() {
    Properties properties = new Properties();
    properties.setProperty("quarry.executor.worker_threads", "3");
    properties.setProperty("quarry.processor.memory_limit_bytes", "4096");
    properties.setProperty("quarry.sort.spill_enabled", "FALSE");

    DefaultSettings settings = new DefaultSettings(properties);

    assertEquals(3, (int) settings.getSettingValue(Settings.Key.WORKER_THREADS));
    assertEquals(4096L, (long) settings.getSettingValue(Settings.Key.PROCESSOR_MEMORY_LIMIT_BYTES));
    assertFalse(settings.<Boolean>getSettingValue(Settings.Key.SORT_SPILL_ENABLED));
  }

  @Test
  void should_build_from_key_map() {
    DefaultSettings settings = DefaultSettings.of(Map.of(Settings.Key.QUERY_MAX_RETRIES, 2));

    assertEquals(2, (int) settings.getSettingValue(Settings.Key.QUERY_MAX_RETRIES));
    assertEquals(Settings.Key.values().length, settings.getSettings().size());
  }

  @Test
  void should_let_system_properties_override_defaults() {
    System.setProperty("quarry.query.max_retries", "3");
    try {
      DefaultSettings settings = DefaultSettings.load();

      assertEquals(3, (int) settings.getSettingValue(Settings.Key.QUERY_MAX_RETRIES));
      assertEquals(1024, (int) settings.getSettingValue(Settings.Key.PAGE_SIZE_ROWS));
    } finally {
      System.clearProperty("quarry.query.max_retries");
    }
  }

  @Test
  void should_reject_malformed_values() {
    Properties properties = new Properties();
    properties.setProperty("quarry.pipeline.page_size_rows", "many");
    assertThrows(IllegalArgumentException.class, () -> new DefaultSettings(properties));

    Properties negative = new Properties();
    negative.setProperty("quarry.query.timeout_millis", "-5");
    assertThrows(IllegalArgumentException.class, () -> new DefaultSettings(negative));

    Properties notBoolean = new Properties();
    notBoolean.setProperty("quarry.sort.spill_enabled", "sometimes");
    assertThrows(IllegalArgumentException.class, () -> new DefaultSettings(notBoolean));
  }

  @Test
  void should_look_up_keys_by_name() {
    assertEquals(
        Settings.Key.PAGE_SIZE_ROWS, Settings.Key.of("quarry.pipeline.page_size_rows").get());
    assertTrue(Settings.Key.of("quarry.unknown").isEmpty());
    assertTrue(Settings.Key.of(null).isEmpty());
  }
}
