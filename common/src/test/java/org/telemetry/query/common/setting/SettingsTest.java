/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.Optional;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SettingsTest {

  @Test
  void should_look_up_key_by_key_value() {
    assertEquals(
        Optional.of(Settings.Key.EXPORTER_PARTITIONS_PER_REQUEST),
        Settings.Key.of("exporter.partitions.per_request"));
    assertEquals(
        Optional.of(Settings.Key.IMPORTER_ID_BLOCK_SIZE),
        Settings.Key.of("IMPORTER.ID_BLOCK.SIZE"));
  }

  @Test
  void should_return_empty_for_unknown_key() {
    assertFalse(Settings.Key.of("exporter.unknown").isPresent());
  }
}
