/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.telemetry.query.expression.DSL.and;
import static org.telemetry.query.expression.DSL.eq;
import static org.telemetry.query.expression.DSL.greater;
import static org.telemetry.query.expression.DSL.in;
import static org.telemetry.query.expression.DSL.not;
import static org.telemetry.query.expression.DSL.or;
import static org.telemetry.query.expression.DSL.schemaIs;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExpressionPrinterTest {

  @Test
  void should_print_predicate() {
    assertEquals("id.resp_p == +80", ExpressionPrinter.print(eq("id.resp_p", 80L)));
    assertEquals("#schema == \"zeek.conn\"", ExpressionPrinter.print(schemaIs("zeek.conn")));
  }

  @Test
  void should_parenthesize_nested_connectives() {
    Expression expression =
        and(eq("proto", "tcp"), or(greater("bytes", 1000L), not(eq("service", "dns"))));

    assertEquals(
        "proto == \"tcp\" && (bytes > +1000 || (! service == \"dns\"))",
        ExpressionPrinter.print(expression));
    assertEquals(ExpressionPrinter.print(expression), expression.toString());
  }

  @Test
  void should_print_membership_lists() {
    assertEquals("port in [+22, +443]", ExpressionPrinter.print(in("port", List.of(22L, 443L))));
  }

  @Test
  void should_print_values_like_data_literals() {
    assertEquals("nil", DataPrinter.print(null));
    assertEquals("T", DataPrinter.print(true));
    assertEquals("F", DataPrinter.print(false));
    assertEquals("+5", DataPrinter.print(5L));
    assertEquals("-3", DataPrinter.print(-3));
    assertEquals("+0", DataPrinter.print(0L));
    assertEquals("4.2", DataPrinter.print(4.2));
    assertEquals("\"a\\\"b\\\\c\"", DataPrinter.print("a\"b\\c"));
    assertEquals("1500ms", DataPrinter.print(Duration.ofMillis(1500)));
    assertEquals("[nil, \"x\"]", DataPrinter.print(Arrays.asList(null, "x")));
  }
}
