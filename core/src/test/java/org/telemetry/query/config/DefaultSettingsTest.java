/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.telemetry.query.common.setting.Settings;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DefaultSettingsTest {

  @Test
  void should_load_values_from_classpath_resource() {
    Settings settings = new DefaultSettings();

    Integer perRequest = settings.getSettingValue(Settings.Key.EXPORTER_PARTITIONS_PER_REQUEST);
    Boolean includeBuffer = settings.getSettingValue(Settings.Key.EXPORTER_STATUS_INCLUDE_BUFFER);
    Long blockSize = settings.getSettingValue(Settings.Key.IMPORTER_ID_BLOCK_SIZE);
    assertEquals(Integer.valueOf(2), perRequest);
    assertEquals(Boolean.TRUE, includeBuffer);
    assertEquals(Long.valueOf(1048576L), blockSize);
    assertEquals(3, settings.getSettings().size());
  }

  @Test
  void should_apply_overrides() {
    Settings settings =
        new DefaultSettings(
            Map.of("exporter.partitions.per_request", "5", "importer.id_block.size", "16"));

    Integer perRequest = settings.getSettingValue(Settings.Key.EXPORTER_PARTITIONS_PER_REQUEST);
    Long blockSize = settings.getSettingValue(Settings.Key.IMPORTER_ID_BLOCK_SIZE);
    assertEquals(Integer.valueOf(5), perRequest);
    assertEquals(Long.valueOf(16L), blockSize);
  }

  @Test
  void should_reject_unknown_or_malformed_settings() {
    assertThrows(
        IllegalArgumentException.class, () -> new DefaultSettings(Map.of("exporter.bogus", "1")));
    assertThrows(
        IllegalArgumentException.class,
        () -> new DefaultSettings(Map.of("exporter.partitions.per_request", "many")));
  }
}
