package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

public record StringOperation(Expression left, Operator operator, Expression right) implements Expression {
  public enum Operator {
    CONTAINS("CONTAINS"), STARTS_WITH("STARTS WITH"), ENDS_WITH("ENDS WITH"), REGEX("=~");

    private final String symbol;

    Operator(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }
  }

  public StringOperation {
    CypherConstructionException.requirePresent(left, "StringOperation", "left operand");
    CypherConstructionException.requirePresent(operator, "StringOperation", "operator");
    CypherConstructionException.requirePresent(right, "StringOperation", "right operand");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
