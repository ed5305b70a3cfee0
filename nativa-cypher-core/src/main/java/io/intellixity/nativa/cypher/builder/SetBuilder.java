package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;

public interface SetBuilder extends Buildable {
  /** More items in the same SET clause. */
  SetBuilder and(Expression... items);
  WithBuilder with(Expression... items);
  ReturnBuilder returning(Expression... items);
}
