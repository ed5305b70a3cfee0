package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.pattern.PatternElement;

public interface CreateBuilder extends Buildable {
  CreateBuilder create(PatternElement... patterns);
  WithBuilder with(Expression... items);
  ReturnBuilder returning(Expression... items);
  SetBuilder set(Expression... items);
}
