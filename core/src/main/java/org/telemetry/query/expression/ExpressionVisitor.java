/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

/**
 * Visitor over the nodes of an {@link Expression}.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface ExpressionVisitor<R, C> {

  R visitConjunction(Conjunction node, C context);

  R visitDisjunction(Disjunction node, C context);

  R visitNegation(Negation node, C context);

  R visitPredicate(Predicate node, C context);
}
