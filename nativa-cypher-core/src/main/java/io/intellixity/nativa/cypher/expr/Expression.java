package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.render.ExpressionRenderer;

/**
 * A node of the Cypher expression tree.
 * <p>
 * The set of variants is closed: every implementation is listed in {@link ExpressionVisitor}, so each
 * algorithm over the tree (rendering, parameter extraction) handles every variant or fails to compile.
 * All variants are immutable; the composition methods below return new nodes.
 */
public interface Expression {
  <R> R accept(ExpressionVisitor<R> visitor);

  /** Cypher text of this expression. Pure function of its fields. */
  default String render() { return ExpressionRenderer.render(this); }

  default Logical and(Expression other) { return Expressions.and(this, other); }
  default Logical or(Expression other) { return Expressions.or(this, other); }
  default Logical xor(Expression other) { return Expressions.xor(this, other); }
  default Expression not() { return Expressions.not(this); }
}
