package io.intellixity.nativa.cypher.expr;

import java.util.*;

public record ListExpression(List<Expression> elements) implements Expression {
  public ListExpression {
    elements = List.copyOf(elements == null ? List.of() : elements);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
