package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;

/** {@code RETURN}: only ordering and paging may follow. */
public interface ReturnBuilder extends Buildable {
  OrderByBuilder orderBy(Expression... items);
  SkipBuilder skip(long count);
  LimitBuilder limit(long count);
}
