package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.expr.Expression;

/** {@code WHERE} following a WITH; may be followed by an update clause as well as a projection. */
public interface WhereBuilder extends Buildable {
  /** Same WHERE, condition combined with AND. */
  WhereBuilder and(Expression condition);
  /** Same WHERE, condition combined with OR. */
  WhereBuilder or(Expression condition);
  WithBuilder with(Expression... items);
  WithBuilder withDistinct(Expression... items);
  ReturnBuilder returning(Expression... items);
  ReturnBuilder returningDistinct(Expression... items);
  SetBuilder set(Expression... items);
  RemoveBuilder remove(Expression... items);
  DeleteBuilder delete(Expression... items);
  DeleteBuilder detachDelete(Expression... items);
}
