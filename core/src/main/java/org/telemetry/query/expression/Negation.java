/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/** Logical NOT. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class Negation implements Expression {

  @NonNull private final Expression operand;

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitNegation(this, context);
  }

  @Override
  public String toString() {
    return ExpressionPrinter.print(this);
  }
}
