package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

import java.util.*;

/** {@code name(arg1, arg2, ...)} with arguments in call order. */
public record FunctionCall(String name, List<Expression> arguments) implements Expression {
  public FunctionCall {
    CypherConstructionException.requireText(name, "Function", "name");
    arguments = List.copyOf(arguments == null ? List.of() : arguments);
  }

  /** Same call with its first argument wrapped in {@code DISTINCT}; no-op when there are no arguments. */
  public FunctionCall distinct() {
    if (arguments.isEmpty() || arguments.get(0) instanceof Distinct) return this;
    List<Expression> args = new ArrayList<>(arguments);
    args.set(0, new Distinct(args.get(0)));
    return new FunctionCall(name, args);
  }

  public AliasedExpression as(String alias) { return Expressions.as(this, alias); }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
