package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

/** Named placeholder rendered as {@code $name}; the value travels in the statement's parameter table. */
public record Parameter(String name, Object value) implements Expression {
  public Parameter {
    CypherConstructionException.requireText(name, "Parameter", "name");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
