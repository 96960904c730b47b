/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.exporter;

import java.util.HashMap;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.telemetry.query.data.Schema;
import org.telemetry.query.exception.ExpressionTailorException;
import org.telemetry.query.expression.Expression;
import org.telemetry.query.expression.checker.Checker;
import org.telemetry.query.expression.checker.CheckerCompiler;

/**
 * Compiled checkers of one query, keyed by schema. Entries are created on first use and live as
 * long as the query. A schema that fails to compile leaves no entry behind.
 */
@Log4j2
public class CheckerCache {

  private final Expression expression;
  private final Map<Schema, Checker> checkers = new HashMap<>();

  public CheckerCache(Expression expression) {
    this.expression = expression;
  }

  /**
   * Returns the checker for a schema, compiling it on first use.
   *
   * @throws ExpressionTailorException if the expression does not apply to the schema
   */
  public Checker get(Schema schema) {
    Checker checker = checkers.get(schema);
    if (checker == null) {
      checker = CheckerCompiler.compile(schema, expression);
      log.debug("tailored expression {} to schema {}", expression, schema.getName());
      checkers.put(schema, checker);
    }
    return checker;
  }

  public int size() {
    return checkers.size();
  }
}
