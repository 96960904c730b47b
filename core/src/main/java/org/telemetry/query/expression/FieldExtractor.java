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
 * Extracts a field by name. A schema field matches if its name equals the extractor or ends with
 * {@code "." + name}, so {@code orig_h} matches {@code id.orig_h}.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class FieldExtractor implements Extractor {

  @NonNull private final String name;

  public boolean matches(String fieldName) {
    return fieldName.equals(name) || fieldName.endsWith("." + name);
  }

  @Override
  public String render() {
    return name;
  }

  @Override
  public String toString() {
    return render();
  }
}
