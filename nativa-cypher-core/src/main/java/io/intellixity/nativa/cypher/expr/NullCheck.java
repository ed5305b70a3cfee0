package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

/** {@code x IS NULL} or {@code x IS NOT NULL}. */
public record NullCheck(Expression expression, boolean isNull) implements Expression {
  public NullCheck {
    CypherConstructionException.requirePresent(expression, "NullCheck", "expression");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
