package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;

public interface RemoveBuilder extends Buildable {
  /** More items in the same REMOVE clause. */
  RemoveBuilder and(Expression... items);
  WithBuilder with(Expression... items);
  ReturnBuilder returning(Expression... items);
}
