/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression.checker;

import lombok.Getter;
import org.telemetry.query.data.Batch;
import org.telemetry.query.data.Schema;
import org.telemetry.query.data.Selection;
import org.telemetry.query.expression.Expression;

/**
 * An expression specialised to one {@link Schema}: field references are resolved to channels and
 * literals are type-checked. Produced by {@link CheckerCompiler}.
 */
public class Checker {

  @Getter private final Schema schema;
  @Getter private final Expression expression;
  private final RowPredicate predicate;

  Checker(Schema schema, Expression expression, RowPredicate predicate) {
    this.schema = schema;
    this.expression = expression;
    this.predicate = predicate;
  }

  /**
   * Evaluates this checker against every row of a batch.
   *
   * @param batch a batch with this checker's schema
   * @return the global ids of the qualifying rows
   */
  public Selection evaluate(Batch batch) {
    if (!schema.equals(batch.getSchema())) {
      throw new IllegalArgumentException(
          "checker for " + schema.getName() + " cannot evaluate " + batch.getSchema().getName());
    }
    Selection.Builder builder = Selection.builder();
    long offset = batch.getOffset();
    int rows = batch.getPositionCount();
    for (int position = 0; position < rows; position++) {
      if (predicate.test(batch, position)) {
        builder.add(offset + position);
      }
    }
    return builder.build();
  }

  @Override
  public String toString() {
    return "Checker{" + schema.getName() + ": " + expression + "}";
  }
}
