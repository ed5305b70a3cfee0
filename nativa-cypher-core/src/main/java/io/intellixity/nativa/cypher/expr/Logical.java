package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

/** Binary boolean combinator. Always rendered parenthesized: {@code (left AND right)}. */
public record Logical(Expression left, Operator operator, Expression right) implements Expression {
  public enum Operator { AND, OR, XOR }

  public Logical {
    CypherConstructionException.requirePresent(left, "Logical", "left operand");
    CypherConstructionException.requirePresent(operator, "Logical", "operator");
    CypherConstructionException.requirePresent(right, "Logical", "right operand");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
