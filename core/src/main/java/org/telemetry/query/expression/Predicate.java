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
 * A comparison {@code extractor op value}, e.g. {@code id.orig_h == "10.0.0.1"}. The value is a
 * literal: Boolean, Long, Double, String, Instant, Duration, a List of those, or null.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Predicate implements Expression {

  @NonNull private final Extractor extractor;
  @NonNull private final RelationalOperator operator;
  private final Object value;

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitPredicate(this, context);
  }

  @Override
  public String toString() {
    return ExpressionPrinter.print(this);
  }
}
