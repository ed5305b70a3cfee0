package io.intellixity.nativa.cypher.exec;

import io.intellixity.nativa.cypher.statement.Statement;

import java.util.Map;

/** Runs one statement inside whatever transaction the caller holds. */
@FunctionalInterface
public interface CypherRunner {
  CypherResult run(String cypher, Map<String, Object> params);

  default CypherResult run(Statement statement) {
    return run(statement.cypher(), statement.params());
  }
}
