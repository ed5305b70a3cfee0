package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.statement.ParameterCollector;

/** {@code LIMIT n}; renders nothing for {@code n == 0}. */
final class LimitClause extends AbstractClause implements WithLimitBuilder {
  private final long count;

  LimitClause(AbstractClause previous, long count) {
    super(previous);
    this.count = requireNonNegative(count, "LIMIT");
  }

  @Override
  String clause() { return "LIMIT"; }

  @Override
  String cypher(ParameterCollector params) {
    return count > 0 ? "LIMIT " + count : "";
  }
}
