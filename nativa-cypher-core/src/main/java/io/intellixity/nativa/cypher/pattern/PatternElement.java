package io.intellixity.nativa.cypher.pattern;

import io.intellixity.nativa.cypher.expr.Expression;
import io.intellixity.nativa.cypher.expr.Variable;

/** Graph-shape expression: node, relationship or path. */
public interface PatternElement extends Expression {
  /** Symbolic name, or null when the element is anonymous. */
  String alias();

  default boolean hasAlias() {
    String a = alias();
    return a != null && !a.isEmpty();
  }

  /** The alias as a plain variable, for clauses that reference an element matched earlier. */
  default Variable asVariable() {
    if (!hasAlias()) throw new IllegalStateException("Pattern element has no alias: " + render());
    return new Variable(alias());
  }
}
