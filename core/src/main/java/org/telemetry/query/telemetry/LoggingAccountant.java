/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link Accountant} writing every report as one JSON line to a Log4j logger. Durations are
 * written in nanoseconds.
 */
public class LoggingAccountant implements Accountant {

  private static final Logger DEFAULT_LOGGER = LogManager.getLogger(LoggingAccountant.class);

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final Set<String> announced = ConcurrentHashMap.newKeySet();
  private final Logger logger;

  public LoggingAccountant() {
    this(DEFAULT_LOGGER);
  }

  public LoggingAccountant(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void announce(String name) {
    if (announced.add(name)) {
      logger.debug("accountant registered component {}", name);
    }
  }

  @Override
  public void report(Report report) {
    logger.info(toJson(report));
  }

  /** Renders a report as a flat JSON object keyed by measurement key. */
  public String toJson(Report report) {
    ObjectNode node = objectMapper.createObjectNode();
    for (Measurement m : report.getMeasurements()) {
      Object value = m.getValue();
      if (value instanceof Duration) {
        node.put(m.getKey(), ((Duration) value).toNanos());
      } else if (value instanceof Long || value instanceof Integer) {
        node.put(m.getKey(), ((Number) value).longValue());
      } else if (value instanceof Number) {
        node.put(m.getKey(), ((Number) value).doubleValue());
      } else {
        node.put(m.getKey(), String.valueOf(value));
      }
    }
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to render report " + report, e);
    }
  }

  public Set<String> getAnnounced() {
    return Set.copyOf(announced);
  }
}
