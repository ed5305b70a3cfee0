package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.expr.Expressions;
import io.intellixity.nativa.cypher.render.ExpressionRenderer;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

final class WhereClause extends AbstractClause implements WhereBuilder {
  private final Expression condition;

  WhereClause(AbstractClause previous, Expression condition) {
    super(previous);
    this.condition = CypherConstructionException.requirePresent(condition, "WHERE", "condition");
  }

  @Override
  String clause() { return "WHERE"; }

  @Override
  public WhereBuilder and(Expression c) {
    return new WhereClause(previous(), Expressions.and(condition, CypherConstructionException.requirePresent(c, "WHERE", "condition")));
  }

  @Override
  public WhereBuilder or(Expression c) {
    return new WhereClause(previous(), Expressions.or(condition, CypherConstructionException.requirePresent(c, "WHERE", "condition")));
  }

  @Override
  String cypher(ParameterCollector params) {
    params.collect(condition);
    return "WHERE " + ExpressionRenderer.reference(condition);
  }
}
