/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression.checker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.telemetry.query.data.Field;
import org.telemetry.query.data.FieldType;
import org.telemetry.query.data.Schema;
import org.telemetry.query.exception.ExpressionTailorException;
import org.telemetry.query.expression.ConceptExtractor;
import org.telemetry.query.expression.Conjunction;
import org.telemetry.query.expression.Disjunction;
import org.telemetry.query.expression.Expression;
import org.telemetry.query.expression.ExpressionVisitor;
import org.telemetry.query.expression.Extractor;
import org.telemetry.query.expression.FieldExtractor;
import org.telemetry.query.expression.MetaExtractor;
import org.telemetry.query.expression.Negation;
import org.telemetry.query.expression.Predicate;
import org.telemetry.query.expression.RelationalOperator;

/**
 * Tailors an expression to a schema.
 *
 * <ul>
 *   <li>A field predicate matching no field of the schema evaluates to false.
 *   <li>A field predicate matching several fields holds if it holds for any of them.
 *   <li>{@code #schema} predicates are decided once per schema.
 *   <li>Comparing a field with a literal of an incompatible type, ordering an unordered type, and
 *       unresolved concepts fail with {@link ExpressionTailorException}.
 * </ul>
 */
public final class CheckerCompiler {

  private CheckerCompiler() {}

  public static Checker compile(Schema schema, Expression expression) {
    RowPredicate predicate = expression.accept(new Tailor(schema), null);
    return new Checker(schema, expression, predicate);
  }

  private static class Tailor implements ExpressionVisitor<RowPredicate, Void> {

    private final Schema schema;

    Tailor(Schema schema) {
      this.schema = schema;
    }

    @Override
    public RowPredicate visitConjunction(Conjunction node, Void context) {
      List<RowPredicate> operands = new ArrayList<>();
      for (Expression operand : node.getOperands()) {
        RowPredicate p = operand.accept(this, context);
        if (p == RowPredicate.FALSE) {
          return RowPredicate.FALSE;
        }
        if (p != RowPredicate.TRUE) {
          operands.add(p);
        }
      }
      if (operands.isEmpty()) {
        return RowPredicate.TRUE;
      }
      return (batch, position) -> {
        for (RowPredicate p : operands) {
          if (!p.test(batch, position)) {
            return false;
          }
        }
        return true;
      };
    }

    @Override
    public RowPredicate visitDisjunction(Disjunction node, Void context) {
      List<RowPredicate> operands = new ArrayList<>();
      for (Expression operand : node.getOperands()) {
        RowPredicate p = operand.accept(this, context);
        if (p == RowPredicate.TRUE) {
          return RowPredicate.TRUE;
        }
        if (p != RowPredicate.FALSE) {
          operands.add(p);
        }
      }
      return anyOf(operands);
    }

    @Override
    public RowPredicate visitNegation(Negation node, Void context) {
      RowPredicate p = node.getOperand().accept(this, context);
      if (p == RowPredicate.TRUE) {
        return RowPredicate.FALSE;
      }
      if (p == RowPredicate.FALSE) {
        return RowPredicate.TRUE;
      }
      return (batch, position) -> !p.test(batch, position);
    }

    @Override
    public RowPredicate visitPredicate(Predicate node, Void context) {
      Extractor extractor = node.getExtractor();
      if (extractor == MetaExtractor.SCHEMA) {
        return tailorSchemaPredicate(node);
      }
      if (extractor instanceof ConceptExtractor) {
        throw new ExpressionTailorException(
            "unresolved concept " + extractor.render() + " in " + node);
      }
      if (!(extractor instanceof FieldExtractor)) {
        throw new ExpressionTailorException("unsupported extractor " + extractor.render());
      }
      FieldExtractor fieldExtractor = (FieldExtractor) extractor;
      List<RowPredicate> matches = new ArrayList<>();
      List<Field> fields = schema.getFields();
      for (int channel = 0; channel < fields.size(); channel++) {
        Field field = fields.get(channel);
        if (fieldExtractor.matches(field.getName())) {
          checkTypes(field, node);
          matches.add(compare(channel, node.getOperator(), node.getValue()));
        }
      }
      return anyOf(matches);
    }

    private RowPredicate tailorSchemaPredicate(Predicate node) {
      RelationalOperator op = node.getOperator();
      Object value = node.getValue();
      if (op.isOrdering()) {
        throw new ExpressionTailorException("cannot order schema names in " + node);
      }
      boolean holds;
      if (op.isMembership()) {
        if (!(value instanceof List)) {
          throw new ExpressionTailorException("expected a list of schema names in " + node);
        }
        holds = ((List<?>) value).contains(schema.getName());
      } else {
        if (!(value instanceof String)) {
          throw new ExpressionTailorException("expected a schema name in " + node);
        }
        holds = schema.getName().equals(value);
      }
      return holds != op.isNegative() ? RowPredicate.TRUE : RowPredicate.FALSE;
    }

    private void checkTypes(Field field, Predicate node) {
      RelationalOperator op = node.getOperator();
      FieldType type = field.getType();
      Object value = node.getValue();
      if (op.isOrdering()) {
        if (type == FieldType.BOOL || type == FieldType.LIST) {
          throw new ExpressionTailorException(
              "type " + type + " of field " + field.getName() + " has no ordering in " + node);
        }
        if (value == null) {
          throw new ExpressionTailorException("cannot order against nil in " + node);
        }
      }
      if (op.isMembership()) {
        if (!(value instanceof List)) {
          throw new ExpressionTailorException("expected a list of candidates in " + node);
        }
        for (Object candidate : (List<?>) value) {
          if (!type.accepts(candidate)) {
            throw new ExpressionTailorException(
                "candidate " + candidate + " does not match type " + type + " in " + node);
          }
        }
      } else if (!type.accepts(value)) {
        throw new ExpressionTailorException(
            "field " + field.getName() + " of type " + type + " cannot compare with " + node);
      }
    }

    private static RowPredicate anyOf(List<RowPredicate> operands) {
      if (operands.isEmpty()) {
        return RowPredicate.FALSE;
      }
      if (operands.size() == 1) {
        return operands.get(0);
      }
      return (batch, position) -> {
        for (RowPredicate p : operands) {
          if (p.test(batch, position)) {
            return true;
          }
        }
        return false;
      };
    }
  }

  private static RowPredicate compare(int channel, RelationalOperator op, Object literal) {
    switch (op) {
      case EQUAL:
        return (batch, position) -> valueEquals(batch.getValue(position, channel), literal);
      case NOT_EQUAL:
        return (batch, position) -> !valueEquals(batch.getValue(position, channel), literal);
      case IN:
        return (batch, position) -> contains((List<?>) literal, batch.getValue(position, channel));
      case NOT_IN:
        return (batch, position) ->
            !contains((List<?>) literal, batch.getValue(position, channel));
      default:
        return (batch, position) -> {
          Object value = batch.getValue(position, channel);
          if (value == null) {
            return false;
          }
          int cmp = compareValues(value, literal);
          switch (op) {
            case LESS:
              return cmp < 0;
            case LESS_EQUAL:
              return cmp <= 0;
            case GREATER:
              return cmp > 0;
            case GREATER_EQUAL:
              return cmp >= 0;
            default:
              throw new IllegalStateException("unexpected operator " + op);
          }
        };
    }
  }

  private static boolean contains(List<?> candidates, Object value) {
    for (Object candidate : candidates) {
      if (valueEquals(value, candidate)) {
        return true;
      }
    }
    return false;
  }

  private static boolean valueEquals(Object value, Object literal) {
    if (value instanceof Number && literal instanceof Number) {
      return compareValues(value, literal) == 0;
    }
    return Objects.equals(value, literal);
  }

  private static int compareValues(Object value, Object literal) {
    if (value instanceof Number && literal instanceof Number) {
      Number a = (Number) value;
      Number b = (Number) literal;
      if (isIntegral(a) && isIntegral(b)) {
        return Long.compare(a.longValue(), b.longValue());
      }
      return Double.compare(a.doubleValue(), b.doubleValue());
    }
    if (value instanceof String && literal instanceof String) {
      return ((String) value).compareTo((String) literal);
    }
    if (value instanceof Instant && literal instanceof Instant) {
      return ((Instant) value).compareTo((Instant) literal);
    }
    if (value instanceof Duration && literal instanceof Duration) {
      return ((Duration) value).compareTo((Duration) literal);
    }
    if (value instanceof Boolean && literal instanceof Boolean) {
      return Boolean.compare((Boolean) value, (Boolean) literal);
    }
    throw new IllegalArgumentException(
        String.format(
            "cannot order %s against %s",
            value.getClass().getSimpleName(),
            literal == null ? "null" : literal.getClass().getSimpleName()));
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }
}
