package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

public record Arithmetic(Expression left, Operator operator, Expression right) implements Expression {
  public enum Operator {
    ADD("+"), SUBTRACT("-"), MULTIPLY("*"), DIVIDE("/"), MODULO("%"), POWER("^");

    private final String symbol;

    Operator(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }
  }

  public Arithmetic {
    CypherConstructionException.requirePresent(left, "Arithmetic", "left operand");
    CypherConstructionException.requirePresent(operator, "Arithmetic", "operator");
    CypherConstructionException.requirePresent(right, "Arithmetic", "right operand");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
