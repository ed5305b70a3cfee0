package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

/** ORDER BY key. A null direction leaves the key plain, so the clause may apply one later. */
public record SortItem(Expression expression, Direction direction) implements Expression {
  public enum Direction { ASC, DESC }

  public SortItem {
    CypherConstructionException.requirePresent(expression, "SortItem", "expression");
  }

  public SortItem withDirection(Direction d) { return new SortItem(expression, d); }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
