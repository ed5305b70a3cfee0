package io.intellixity.nativa.cypher.builder;

public interface OrderByBuilder extends Buildable {
  /** Applies ASC to every key that has no explicit direction. */
  OrderByBuilder ascending();
  /** Applies DESC to every key that has no explicit direction. */
  OrderByBuilder descending();
  SkipBuilder skip(long count);
  LimitBuilder limit(long count);
}
