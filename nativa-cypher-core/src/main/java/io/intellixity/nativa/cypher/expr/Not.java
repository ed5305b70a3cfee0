package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

/**
 * Boolean negation {@code NOT (x)}.
 * <p>
 * {@link Expressions#not(Expression)} cancels double negation at construction; stacked instances built
 * through the constructor cancel pairwise when rendered.
 */
public record Not(Expression expression) implements Expression {
  public Not {
    CypherConstructionException.requirePresent(expression, "Not", "expression");
  }

  @Override
  public Expression not() { return expression; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
