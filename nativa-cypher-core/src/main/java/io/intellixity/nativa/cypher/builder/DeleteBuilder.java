package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;

public interface DeleteBuilder extends Buildable {
  WithBuilder with(Expression... items);
  ReturnBuilder returning(Expression... items);
}
