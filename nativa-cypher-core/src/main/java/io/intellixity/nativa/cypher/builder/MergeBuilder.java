package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;

public interface MergeBuilder extends Buildable {
  /** Adds items to {@code ON CREATE SET}; repeated calls accumulate. */
  MergeBuilder onCreate(Expression... items);
  /** Adds items to {@code ON MATCH SET}; repeated calls accumulate. */
  MergeBuilder onMatch(Expression... items);
  WithBuilder with(Expression... items);
  ReturnBuilder returning(Expression... items);
}
