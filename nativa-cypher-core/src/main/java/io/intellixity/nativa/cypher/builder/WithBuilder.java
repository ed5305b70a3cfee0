package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;

public interface WithBuilder extends ClauseChain {
  WhereBuilder where(Expression condition);
  WithOrderByBuilder orderBy(Expression... items);
  WithSkipBuilder skip(long count);
  WithLimitBuilder limit(long count);
}
