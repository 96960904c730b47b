/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;
import org.telemetry.query.common.setting.Settings;

/**
 * Settings backed by the {@code telemetry-query.properties} classpath resource. Values are parsed
 * into the type registered for each key; programmatic overrides win over the resource.
 */
@Log4j2
public class DefaultSettings extends Settings {

  public static final String RESOURCE = "telemetry-query.properties";

  private static final Map<Key, Function<String, Object>> PARSERS =
      new ImmutableMap.Builder<Key, Function<String, Object>>()
          .put(Key.EXPORTER_PARTITIONS_PER_REQUEST, Integer::valueOf)
          .put(Key.EXPORTER_STATUS_INCLUDE_BUFFER, Boolean::valueOf)
          .put(Key.IMPORTER_ID_BLOCK_SIZE, Long::valueOf)
          .build();

  private static final Map<Key, Object> DEFAULTS =
      new ImmutableMap.Builder<Key, Object>()
          .put(Key.EXPORTER_PARTITIONS_PER_REQUEST, 2)
          .put(Key.EXPORTER_STATUS_INCLUDE_BUFFER, true)
          .put(Key.IMPORTER_ID_BLOCK_SIZE, 1L << 20)
          .build();

  private final Map<Key, Object> values = new EnumMap<>(Key.class);

  public DefaultSettings() {
    this(Map.of());
  }

  /** Loads the classpath resource, then applies {@code overrides} given as raw strings. */
  public DefaultSettings(Map<String, String> overrides) {
    values.putAll(DEFAULTS);
    Properties properties = load();
    properties.stringPropertyNames().forEach(k -> set(k, properties.getProperty(k)));
    overrides.forEach(this::set);
  }

  private static Properties load() {
    Properties properties = new Properties();
    try (InputStream in = DefaultSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.debug("{} not found on the classpath, using defaults", RESOURCE);
        return properties;
      }
      properties.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("failed to read " + RESOURCE, e);
    }
    return properties;
  }

  private void set(String keyValue, String rawValue) {
    Key key =
        Key.of(keyValue)
            .orElseThrow(() -> new IllegalArgumentException("unknown setting: " + keyValue));
    try {
      values.put(key, PARSERS.get(key).apply(rawValue.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("invalid value for setting %s: %s", keyValue, rawValue), e);
    }
  }

  @SuppressWarnings("unchecked")
  @Override
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }

  @Override
  public List<?> getSettings() {
    return ImmutableList.copyOf(values.entrySet());
  }
}
