package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.statement.ParameterCollector;

/** {@code SKIP n}; renders nothing for {@code n == 0}. */
final class SkipClause extends AbstractClause implements WithSkipBuilder {
  private final long count;

  SkipClause(AbstractClause previous, long count) {
    super(previous);
    this.count = requireNonNegative(count, "SKIP");
  }

  @Override
  String clause() { return "SKIP"; }

  @Override
  public WithLimitBuilder limit(long n) { return new LimitClause(this, n); }

  @Override
  String cypher(ParameterCollector params) {
    return count > 0 ? "SKIP " + count : "";
  }
}
