package io.intellixity.nativa.cypher.exec;

import io.intellixity.nativa.cypher.CypherException;

/** Failure raised by the database or driver while running a statement. */
public final class CypherExecutionException extends CypherException {
  public CypherExecutionException(String message, Throwable cause) {
    super(Kind.EXECUTION, "Executor", message, cause);
  }
}
