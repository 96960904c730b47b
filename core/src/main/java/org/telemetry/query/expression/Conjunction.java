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

/** Logical AND over one or more operands. */
@Getter
@EqualsAndHashCode
public class Conjunction implements Expression {

  private final List<Expression> operands;

  public Conjunction(List<? extends Expression> operands) {
    Preconditions.checkArgument(!operands.isEmpty(), "conjunction needs operands");
    this.operands = ImmutableList.copyOf(operands);
  }

  @Override
  public <R, C> R accept(ExpressionVisitor<R, C> visitor, C context) {
    return visitor.visitConjunction(this, context);
  }

  @Override
  public String toString() {
    return ExpressionPrinter.print(this);
  }
}
