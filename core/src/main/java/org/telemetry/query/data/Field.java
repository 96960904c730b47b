/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** A named, typed column of a {@link Schema}. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "of")
public class Field {

  private final String name;
  private final FieldType type;

  @Override
  public String toString() {
    return name + ": " + type.name().toLowerCase();
  }
}
