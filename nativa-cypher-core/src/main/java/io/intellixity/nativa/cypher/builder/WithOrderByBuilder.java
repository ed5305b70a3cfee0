package io.intellixity.nativa.cypher.builder;

/** ORDER BY of a WITH; the chain continues afterwards. */
public interface WithOrderByBuilder extends OrderByBuilder, ClauseChain {
  @Override WithOrderByBuilder ascending();
  @Override WithOrderByBuilder descending();
  @Override WithSkipBuilder skip(long count);
  @Override WithLimitBuilder limit(long count);
}
