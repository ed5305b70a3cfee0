package io.intellixity.nativa.cypher.builder;

public interface WithSkipBuilder extends SkipBuilder, ClauseChain {
  @Override WithLimitBuilder limit(long count);
}
