/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Refers to a taxonomy concept such as {@code net.src.ip}. Concepts are replaced by the concrete
 * fields that implement them before an expression is compiled.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class ConceptExtractor implements Extractor {

  @NonNull private final String name;

  @Override
  public String render() {
    return name;
  }

  @Override
  public String toString() {
    return render();
  }
}
