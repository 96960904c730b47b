/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.telemetry.query.expression;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Logical OR over one or more operands. */
@Getter
@EqualsAndHashCode
public class Disjunction implements Expression {

  private final List<Expression> operands;

  public Disjunction(List<? extends Expression> operands) {
    Preconditions.checkArgument(!operands.isEmpty(), "disjunction needs operands");
    this.operands = ImmutableList.copyOf(operands);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitDisjunction(this, context);
  }

  @Override
  public String toString() {
    return ExpressionPrinter.print(this);
  }
}
