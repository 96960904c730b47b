/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Setting. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Exporter settings. */
    EXPORTER_PARTITIONS_PER_REQUEST("exporter.partitions.per_request"),
    EXPORTER_STATUS_INCLUDE_BUFFER("exporter.status.include_buffer"),

    /** Importer settings. */
    IMPORTER_ID_BLOCK_SIZE("importer.id_block.size");

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
      String key = keyValue.toLowerCase();
      return Optional.ofNullable(ALL_KEYS.get(key));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  public abstract List<?> getSettings();
}
