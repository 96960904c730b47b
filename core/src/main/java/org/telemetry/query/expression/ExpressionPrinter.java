/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

import java.util.List;

/**
 * Renders an {@link Expression} in the query language, e.g. {@code #schema == "zeek.conn" && (x
 * < +5 || y in [+1, +2])}.
 */
public class ExpressionPrinter implements ExpressionVisitor<Void, StringBuilder> {

  private static final ExpressionPrinter INSTANCE = new ExpressionPrinter();

  public static String print(Expression expression) {
    StringBuilder out = new StringBuilder();
    expression.accept(INSTANCE, out);
    return out.toString();
  }

  @Override
  public Void visitConjunction(Conjunction node, StringBuilder out) {
    printConnective(node.getOperands(), " && ", out);
    return null;
  }

  @Override
  public Void visitDisjunction(Disjunction node, StringBuilder out) {
    printConnective(node.getOperands(), " || ", out);
    return null;
  }

  @Override
  public Void visitNegation(Negation node, StringBuilder out) {
    out.append("! ");
    printOperand(node.getOperand(), out);
    return null;
  }

  @Override
  public Void visitPredicate(Predicate node, StringBuilder out) {
    out.append(node.getExtractor().render())
        .append(' ')
        .append(node.getOperator().getSymbol())
        .append(' ');
    DataPrinter.print(out, node.getValue());
    return null;
  }

  private void printConnective(List<Expression> operands, String separator, StringBuilder out) {
    for (int i = 0; i < operands.size(); i++) {
      if (i > 0) {
        out.append(separator);
      }
      printOperand(operands.get(i), out);
    }
  }

  private void printOperand(Expression operand, StringBuilder out) {
    boolean nested = !(operand instanceof Predicate);
    if (nested) {
      out.append('(');
    }
    operand.accept(this, out);
    if (nested) {
      out.append(')');
    }
  }
}
