/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression.taxonomy;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.telemetry.query.expression.ConceptExtractor;
import org.telemetry.query.expression.Conjunction;
import org.telemetry.query.expression.Disjunction;
import org.telemetry.query.expression.Expression;
import org.telemetry.query.expression.ExpressionVisitor;
import org.telemetry.query.expression.FieldExtractor;
import org.telemetry.query.expression.Negation;
import org.telemetry.query.expression.Predicate;

/**
 * Substitutes concept identifiers in predicates with expressions containing only concrete field
 * names. {@code c == x} becomes the disjunction of {@code f == x} over every field {@code f} that
 * {@code c} expands to; for {@code !=} and {@code !in} the expansion is a conjunction instead.
 * Concepts may refer to other concepts; cycles are cut. Unknown concepts are left untouched.
 */
@Log4j2
@RequiredArgsConstructor
public class TaxonomyResolver implements ExpressionVisitor<Expression, Void> {

  private final Taxonomies taxonomies;

  public static Expression resolve(Taxonomies taxonomies, Expression expression) {
    return expression.accept(new TaxonomyResolver(taxonomies), null);
  }

  @Override
  public Expression visitConjunction(Conjunction node, Void context) {
    return new Conjunction(visitAll(node.getOperands()));
  }

  @Override
  public Expression visitDisjunction(Disjunction node, Void context) {
    return new Disjunction(visitAll(node.getOperands()));
  }

  @Override
  public Expression visitNegation(Negation node, Void context) {
    return new Negation(node.getOperand().accept(this, context));
  }

  @Override
  public Expression visitPredicate(Predicate node, Void context) {
    if (!(node.getExtractor() instanceof ConceptExtractor)) {
      return node;
    }
    String concept = ((ConceptExtractor) node.getExtractor()).getName();
    if (!taxonomies.isConcept(concept)) {
      log.debug("leaves unknown concept {} unresolved", concept);
      return node;
    }
    Set<String> fields = new LinkedHashSet<>();
    expand(concept, fields, new HashSet<>());
    if (fields.isEmpty()) {
      return node;
    }
    List<Expression> substitutes = new ArrayList<>();
    for (String field : fields) {
      substitutes.add(
          new Predicate(new FieldExtractor(field), node.getOperator(), node.getValue()));
    }
    if (substitutes.size() == 1) {
      return substitutes.get(0);
    }
    return node.getOperator().isNegative()
        ? new Conjunction(substitutes)
        : new Disjunction(substitutes);
  }

  private void expand(String concept, Set<String> fields, Set<String> visited) {
    if (!visited.add(concept)) {
      return;
    }
    for (String member : taxonomies.getConcepts().get(concept)) {
      if (taxonomies.isConcept(member)) {
        expand(member, fields, visited);
      } else {
        fields.add(member);
      }
    }
  }

  private List<Expression> visitAll(List<Expression> operands) {
    List<Expression> result = new ArrayList<>(operands.size());
    for (Expression operand : operands) {
      result.add(operand.accept(this, null));
    }
    return result;
  }
}
