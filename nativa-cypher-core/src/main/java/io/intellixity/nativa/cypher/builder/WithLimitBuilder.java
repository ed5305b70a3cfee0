package io.intellixity.nativa.cypher.builder;

public interface WithLimitBuilder extends LimitBuilder, ClauseChain {
}
