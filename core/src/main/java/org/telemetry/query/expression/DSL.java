/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

import java.util.Arrays;
import java.util.List;
import lombok.experimental.UtilityClass;

/** Static factories for building expressions in code. */
@UtilityClass
public class DSL {

  public Expression and(Expression... operands) {
    return new Conjunction(Arrays.asList(operands));
  }

  public Expression or(Expression... operands) {
    return new Disjunction(Arrays.asList(operands));
  }

  public Expression not(Expression operand) {
    return new Negation(operand);
  }

  public FieldExtractor field(String name) {
    return new FieldExtractor(name);
  }

  public ConceptExtractor concept(String name) {
    return new ConceptExtractor(name);
  }

  public Predicate predicate(Extractor extractor, RelationalOperator op, Object value) {
    return new Predicate(extractor, op, value);
  }

  public Predicate eq(String field, Object value) {
    return predicate(field(field), RelationalOperator.EQUAL, value);
  }

  public Predicate neq(String field, Object value) {
    return predicate(field(field), RelationalOperator.NOT_EQUAL, value);
  }

  public Predicate less(String field, Object value) {
    return predicate(field(field), RelationalOperator.LESS, value);
  }

  public Predicate lessOrEqual(String field, Object value) {
    return predicate(field(field), RelationalOperator.LESS_EQUAL, value);
  }

  public Predicate greater(String field, Object value) {
    return predicate(field(field), RelationalOperator.GREATER, value);
  }

  public Predicate greaterOrEqual(String field, Object value) {
    return predicate(field(field), RelationalOperator.GREATER_EQUAL, value);
  }

  public Predicate in(String field, List<?> values) {
    return predicate(field(field), RelationalOperator.IN, values);
  }

  public Predicate schemaIs(String schemaName) {
    return predicate(MetaExtractor.SCHEMA, RelationalOperator.EQUAL, schemaName);
  }
}
