package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;

/** {@code MATCH} / {@code OPTIONAL MATCH}. */
public interface MatchBuilder extends ClauseChain {
  /** Attaches a condition to this MATCH. Calling it again combines the conditions with AND. */
  MatchBuilder where(Expression condition);
}
