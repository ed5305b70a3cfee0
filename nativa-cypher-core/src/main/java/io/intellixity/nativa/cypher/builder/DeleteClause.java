package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.List;

final class DeleteClause extends AbstractClause implements DeleteBuilder {
  private final boolean detach;
  private final List<Expression> items;

  DeleteClause(AbstractClause previous, boolean detach, List<Expression> items) {
    super(previous);
    this.detach = detach;
    this.items = List.copyOf(items);
  }

  @Override
  String clause() { return detach ? "DETACH DELETE" : "DELETE"; }

  @Override
  String cypher(ParameterCollector params) {
    return clause() + " " + SetItems.delete(clause(), items, params);
  }
}
