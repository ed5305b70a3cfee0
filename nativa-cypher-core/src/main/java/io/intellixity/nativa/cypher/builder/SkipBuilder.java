package io.intellixity.nativa.cypher.builder;

public interface SkipBuilder extends Buildable {
  LimitBuilder limit(long count);
}
