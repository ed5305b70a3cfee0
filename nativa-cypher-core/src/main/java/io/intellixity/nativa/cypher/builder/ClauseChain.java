package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.pattern.PatternElement;

/** Clauses that may follow a MATCH or a WITH (and start a fresh chain). */
public interface ClauseChain extends Buildable {
  MatchBuilder match(PatternElement... patterns);
  MatchBuilder optionalMatch(PatternElement... patterns);
  CreateBuilder create(PatternElement... patterns);
  MergeBuilder merge(PatternElement pattern);
  WithBuilder with(Expression... items);
  WithBuilder withDistinct(Expression... items);
  ReturnBuilder returning(Expression... items);
  ReturnBuilder returningDistinct(Expression... items);
  SetBuilder set(Expression... items);
  RemoveBuilder remove(Expression... items);
  DeleteBuilder delete(Expression... items);
  DeleteBuilder detachDelete(Expression... items);
  UnwindBuilder unwind(Expression list, String alias);
}
