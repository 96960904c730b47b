/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.util.Set;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LoggingAccountantTest {

  @Mock private Logger logger;

  @Test
  void should_render_report_as_one_json_line() {
    LoggingAccountant accountant = new LoggingAccountant(logger);
    Report report =
        Report.builder()
            .put("exporter.hits", 42L)
            .put("exporter.selectivity", 0.5)
            .put("exporter.runtime", Duration.ofMillis(3))
            .build();

    accountant.report(report);

    verify(logger)
        .info(
            "{\"exporter.hits\":42,\"exporter.selectivity\":0.5,"
                + "\"exporter.runtime\":3000000}");
  }

  @Test
  void should_remember_announced_components() {
    LoggingAccountant accountant = new LoggingAccountant(logger);

    accountant.announce("exporter-1");
    accountant.announce("exporter-1");

    assertEquals(Set.of("exporter-1"), accountant.getAnnounced());
  }

  @Test
  void should_render_other_values_as_strings() {
    LoggingAccountant accountant = new LoggingAccountant(logger);

    assertEquals("{\"state\":\"done\"}", accountant.toJson(Report.of("state", "done")));
  }
}
