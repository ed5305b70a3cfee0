package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

public record Comparison(Expression left, Operator operator, Expression right) implements Expression {
  public enum Operator {
    EQ("="), NE("<>"), GT(">"), GTE(">="), LT("<"), LTE("<="), IN("IN");

    private final String symbol;

    Operator(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }
  }

  public Comparison {
    CypherConstructionException.requirePresent(left, "Comparison", "left operand");
    CypherConstructionException.requirePresent(operator, "Comparison", "operator");
    CypherConstructionException.requirePresent(right, "Comparison", "right operand");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
