package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.List;

final class ReturnClause extends AbstractClause implements ReturnBuilder {
  private final boolean distinct;
  private final List<Expression> items;

  ReturnClause(AbstractClause previous, boolean distinct, List<Expression> items) {
    super(previous);
    this.distinct = distinct;
    this.items = List.copyOf(items);
  }

  @Override
  String clause() { return "RETURN"; }

  @Override
  public OrderByBuilder orderBy(Expression... keys) { return new OrderByClause(this, OrderByClause.sortItems(keys)); }

  @Override
  public SkipBuilder skip(long count) { return new SkipClause(this, count); }

  @Override
  public LimitBuilder limit(long count) { return new LimitClause(this, count); }

  @Override
  String cypher(ParameterCollector params) {
    return (distinct ? "RETURN DISTINCT " : "RETURN ") + renderItems(items, params);
  }
}
