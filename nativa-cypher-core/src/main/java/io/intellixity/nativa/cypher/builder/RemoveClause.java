package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.List;

final class RemoveClause extends AbstractClause implements RemoveBuilder {
  private final List<Expression> items;

  RemoveClause(AbstractClause previous, List<Expression> items) {
    super(previous);
    this.items = List.copyOf(items);
  }

  @Override
  String clause() { return "REMOVE"; }

  @Override
  public RemoveBuilder and(Expression... more) { return new RemoveClause(previous(), concat(items, more, "REMOVE")); }

  @Override
  String cypher(ParameterCollector params) {
    return "REMOVE " + SetItems.remove(clause(), items, params);
  }
}
