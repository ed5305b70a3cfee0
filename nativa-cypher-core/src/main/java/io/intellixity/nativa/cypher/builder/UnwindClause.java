package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.render.ExpressionRenderer;
import io.intellixity.nativa.cypher.render.Identifiers;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

final class UnwindClause extends AbstractClause implements UnwindBuilder {
  private final Expression list;
  private final String alias;

  UnwindClause(AbstractClause previous, Expression list, String alias) {
    super(previous);
    this.list = CypherConstructionException.requirePresent(list, "UNWIND", "list expression");
    this.alias = CypherConstructionException.requireText(alias, "UNWIND", "alias");
  }

  @Override
  String clause() { return "UNWIND"; }

  @Override
  String cypher(ParameterCollector params) {
    params.collect(list);
    return "UNWIND " + ExpressionRenderer.reference(list) + " AS " + Identifiers.quoteIfNeeded(alias);
  }
}
