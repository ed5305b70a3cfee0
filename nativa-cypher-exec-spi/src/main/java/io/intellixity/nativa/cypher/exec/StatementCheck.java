package io.intellixity.nativa.cypher.exec;

import io.intellixity.nativa.cypher.statement.Statement;

/**
 * Hook run on every statement before it is sent; throwing rejects the statement.
 * <p>
 * A validator plugs in as {@code validator::requireValid}.
 */
@FunctionalInterface
public interface StatementCheck {
  StatementCheck NONE = statement -> {};

  void check(Statement statement);
}
