package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

public record Distinct(Expression expression) implements Expression {
  public Distinct {
    CypherConstructionException.requirePresent(expression, "Distinct", "expression");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
