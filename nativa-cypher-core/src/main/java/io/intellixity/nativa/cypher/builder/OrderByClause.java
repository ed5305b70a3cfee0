package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.expr.SortItem;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.*;

/** {@code ORDER BY}; after a RETURN it is terminal apart from paging, after a WITH the chain continues. */
final class OrderByClause extends AbstractClause implements WithOrderByBuilder {
  private final List<SortItem> keys;

  OrderByClause(AbstractClause previous, List<SortItem> keys) {
    super(previous);
    this.keys = List.copyOf(keys);
  }

  static List<SortItem> sortItems(Expression[] keys) {
    List<SortItem> out = new ArrayList<>();
    for (Expression e : items(keys, "ORDER BY")) {
      out.add(e instanceof SortItem s ? s : new SortItem(e, null));
    }
    return out;
  }

  @Override
  String clause() { return "ORDER BY"; }

  @Override
  public WithOrderByBuilder ascending() { return withDefaultDirection(SortItem.Direction.ASC); }

  @Override
  public WithOrderByBuilder descending() { return withDefaultDirection(SortItem.Direction.DESC); }

  private OrderByClause withDefaultDirection(SortItem.Direction d) {
    List<SortItem> out = new ArrayList<>(keys.size());
    for (SortItem k : keys) out.add(k.direction() == null ? k.withDirection(d) : k);
    return new OrderByClause(previous(), out);
  }

  @Override
  public WithSkipBuilder skip(long count) { return new SkipClause(this, count); }

  @Override
  public WithLimitBuilder limit(long count) { return new LimitClause(this, count); }

  @Override
  String cypher(ParameterCollector params) {
    return "ORDER BY " + renderItems(keys, params);
  }
}
