package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.pattern.PatternElement;
import io.intellixity.nativa.cypher.statement.ParameterCollector;

import java.util.List;

final class CreateClause extends AbstractClause implements CreateBuilder {
  private final List<PatternElement> patterns;

  CreateClause(AbstractClause previous, List<PatternElement> patterns) {
    super(previous);
    this.patterns = List.copyOf(patterns);
  }

  @Override
  String clause() { return "CREATE"; }

  @Override
  String cypher(ParameterCollector params) {
    return "CREATE " + renderPatterns(patterns, params);
  }
}
