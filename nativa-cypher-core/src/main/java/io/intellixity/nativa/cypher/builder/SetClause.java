package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.List;

final class SetClause extends AbstractClause implements SetBuilder {
  private final List<Expression> items;

  SetClause(AbstractClause previous, List<Expression> items) {
    super(previous);
    this.items = List.copyOf(items);
  }

  @Override
  String clause() { return "SET"; }

  @Override
  public SetBuilder and(Expression... more) { return new SetClause(previous(), concat(items, more, "SET")); }

  @Override
  String cypher(ParameterCollector params) {
    return "SET " + SetItems.set(clause(), items, params);
  }
}
