/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Comparison operators of a {@link Predicate}. */
@RequiredArgsConstructor
public enum RelationalOperator {
  EQUAL("=="),
  NOT_EQUAL("!="),
  LESS("<"),
  LESS_EQUAL("<="),
  GREATER(">"),
  GREATER_EQUAL(">="),
  IN("in"),
  NOT_IN("!in");

  @Getter private final String symbol;

  /** Returns true for operators that require an ordering on the compared values. */
  public boolean isOrdering() {
    return this == LESS || this == LESS_EQUAL || this == GREATER || this == GREATER_EQUAL;
  }

  /** Returns true for operators whose value is a list of candidates. */
  public boolean isMembership() {
    return this == IN || this == NOT_IN;
  }

  /** Returns true for operators that hold when nothing matches. */
  public boolean isNegative() {
    return this == NOT_EQUAL || this == NOT_IN;
  }
}
