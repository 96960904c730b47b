/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.data;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Types of the values stored in a {@link Batch} column. */
public enum FieldType {
  BOOL,
  INTEGER,
  COUNT,
  REAL,
  STRING,
  TIME,
  DURATION,
  LIST;

  /** Returns true if values of this type are numbers comparable with each other. */
  public boolean isNumeric() {
    return this == INTEGER || this == COUNT || this == REAL;
  }

  /**
   * Returns true if the given literal can be compared against values of this type. Numbers are
   * mutually comparable; all other types compare only against literals of the same kind.
   */
  public boolean accepts(Object literal) {
    if (literal == null) {
      return true;
    }
    switch (this) {
      case BOOL:
        return literal instanceof Boolean;
      case INTEGER:
      case COUNT:
      case REAL:
        return literal instanceof Number;
      case STRING:
        return literal instanceof String;
      case TIME:
        return literal instanceof Instant;
      case DURATION:
        return literal instanceof Duration;
      case LIST:
        return literal instanceof List;
      default:
        return false;
    }
  }
}
