package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.List;

final class WithClause extends AbstractClause implements WithBuilder {
  private final boolean distinct;
  private final List<Expression> items;

  WithClause(AbstractClause previous, boolean distinct, List<Expression> items) {
    super(previous);
    this.distinct = distinct;
    this.items = List.copyOf(items);
  }

  @Override
  String clause() { return "WITH"; }

  @Override
  public WhereBuilder where(Expression condition) { return new WhereClause(this, condition); }

  @Override
  public WithOrderByBuilder orderBy(Expression... keys) { return new OrderByClause(this, OrderByClause.sortItems(keys)); }

  @Override
  public WithSkipBuilder skip(long count) { return new SkipClause(this, count); }

  @Override
  public WithLimitBuilder limit(long count) { return new LimitClause(this, count); }

  @Override
  String cypher(ParameterCollector params) {
    return (distinct ? "WITH DISTINCT " : "WITH ") + renderItems(items, params);
  }
}
