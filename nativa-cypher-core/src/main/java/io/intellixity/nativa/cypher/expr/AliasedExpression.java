package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

/** {@code expression AS alias}; the alias is backtick-quoted when it is not a plain identifier. */
public record AliasedExpression(Expression expression, String alias) implements Expression {
  public AliasedExpression {
    CypherConstructionException.requirePresent(expression, "Alias", "expression");
    CypherConstructionException.requireText(alias, "Alias", "alias");
  }

  /** Reference to the alias for later clauses ({@code WITH count(p) AS total ... RETURN total}). */
  public Variable asVariable() { return new Variable(alias); }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
