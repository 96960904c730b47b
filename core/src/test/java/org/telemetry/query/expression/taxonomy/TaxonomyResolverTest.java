/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression.taxonomy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.telemetry.query.expression.DSL.and;
import static org.telemetry.query.expression.DSL.concept;
import static org.telemetry.query.expression.DSL.eq;
import static org.telemetry.query.expression.DSL.neq;
import static org.telemetry.query.expression.DSL.or;
import static org.telemetry.query.expression.DSL.predicate;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.telemetry.query.expression.Expression;
import org.telemetry.query.expression.RelationalOperator;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class TaxonomyResolverTest {

  private final Taxonomies taxonomies =
      Taxonomies.builder()
          .concept("net.src.ip", "zeek.conn.id.orig_h", "suricata.src_ip")
          .concept("net.ip", "net.src.ip", "net.dst.ip")
          .concept("net.dst.ip", "zeek.conn.id.resp_h")
          .concept("loop.a", "loop.b", "x")
          .concept("loop.b", "loop.a", "y")
          .build();

  @Test
  void should_expand_concept_into_disjunction_of_fields() {
    Expression resolved = resolve(conceptEquals("net.src.ip"));

    assertEquals(
        or(eq("zeek.conn.id.orig_h", "1.2.3.4"), eq("suricata.src_ip", "1.2.3.4")), resolved);
  }

  @Test
  void should_expand_nested_concepts() {
    Expression resolved = resolve(conceptEquals("net.ip"));

    assertEquals(
        or(
            eq("zeek.conn.id.orig_h", "1.2.3.4"),
            eq("suricata.src_ip", "1.2.3.4"),
            eq("zeek.conn.id.resp_h", "1.2.3.4")),
        resolved);
  }

  @Test
  void should_expand_negative_operators_into_conjunction() {
    Expression resolved =
        resolve(predicate(concept("net.src.ip"), RelationalOperator.NOT_EQUAL, "1.2.3.4"));

    assertEquals(
        and(neq("zeek.conn.id.orig_h", "1.2.3.4"), neq("suricata.src_ip", "1.2.3.4")), resolved);
  }

  @Test
  void should_cut_cycles() {
    Expression resolved = resolve(predicate(concept("loop.a"), RelationalOperator.EQUAL, 1L));

    assertEquals(or(eq("y", 1L), eq("x", 1L)), resolved);
  }

  @Test
  void should_leave_unknown_concepts_and_fields_untouched() {
    Expression unknown = conceptEquals("net.app");
    Expression plain = and(eq("proto", "tcp"), unknown);

    assertEquals(plain, resolve(plain));
  }

  private Expression resolve(Expression expression) {
    return TaxonomyResolver.resolve(taxonomies, expression);
  }

  private static Expression conceptEquals(String name) {
    return predicate(concept(name), RelationalOperator.EQUAL, "1.2.3.4");
  }
}
