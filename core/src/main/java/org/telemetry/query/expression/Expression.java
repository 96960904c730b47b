/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

/**
 * A boolean query expression over rows. Expressions are immutable trees of {@link Conjunction},
 * {@link Disjunction}, {@link Negation} and {@link Predicate} nodes.
 */
public interface Expression {

  /**
   * Accept a visitor.
   *
   * @param visitor visitor
   * @param context visit context
   * @param <R> result type
   * @param <C> context type
   * @return visitor result
   */
  <R, C> R accept(ExpressionVisitor<R, C> visitor, C context);
}
