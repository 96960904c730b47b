/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression.taxonomy;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Maps concept names to the fields or other concepts that implement them. For example the concept
 * {@code net.src.ip} may map to {@code zeek.conn.id.orig_h} and {@code suricata.src_ip}.
 */
@Getter
@EqualsAndHashCode
public class Taxonomies {

  private static final Taxonomies EMPTY = new Taxonomies(Map.of());

  private final Map<String, List<String>> concepts;

  public Taxonomies(Map<String, ? extends List<String>> concepts) {
    ImmutableMap.Builder<String, List<String>> builder = ImmutableMap.builder();
    concepts.forEach((name, members) -> builder.put(name, ImmutableList.copyOf(members)));
    this.concepts = builder.build();
  }

  public static Taxonomies empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isConcept(String name) {
    return concepts.containsKey(name);
  }

  /** Builder. */
  public static class Builder {
    private final Map<String, List<String>> concepts = new LinkedHashMap<>();

    public Builder concept(String name, String... members) {
      concepts.put(name, List.of(members));
      return this;
    }

    public Taxonomies build() {
      return new Taxonomies(concepts);
    }
  }
}
