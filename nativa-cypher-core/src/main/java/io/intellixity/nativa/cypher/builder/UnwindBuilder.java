package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.pattern.PatternElement;

/** {@code UNWIND list AS alias}; behaves like a fresh chain for what follows. */
public interface UnwindBuilder extends Buildable {
  MatchBuilder match(PatternElement... patterns);
  MatchBuilder optionalMatch(PatternElement... patterns);
  CreateBuilder create(PatternElement... patterns);
  MergeBuilder merge(PatternElement pattern);
  WithBuilder with(Expression... items);
  ReturnBuilder returning(Expression... items);
}
