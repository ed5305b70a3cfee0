package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

public record Variable(String name) implements Expression {
  public Variable {
    CypherConstructionException.requireText(name, "Variable", "name");
  }

  public PropertyExpression property(String property) {
    return new PropertyExpression(this, property);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
