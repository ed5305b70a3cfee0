package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

/** SET item: {@code p.name = v}, {@code p = {..}} or {@code p += {..}}. */
public record Assignment(Expression target, Operator operator, Expression value) implements Expression {
  public enum Operator {
    ASSIGN("="), MUTATE("+=");

    private final String symbol;

    Operator(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }
  }

  public Assignment {
    CypherConstructionException.requirePresent(target, "Assignment", "target");
    operator = (operator == null) ? Operator.ASSIGN : operator;
    CypherConstructionException.requirePresent(value, "Assignment", "value");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
