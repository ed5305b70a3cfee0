package io.intellixity.nativa.cypher.builder;

import io.intellixity.nativa.cypher.statement.Statement;

public interface Buildable {
  /**
   * Text and parameters of the whole chain ending here: every clause's local text joined by single spaces,
   * parameter tables merged with later clauses winning on a shared name.
   *
   * @throws io.intellixity.nativa.cypher.CypherException the first failure of any clause in the chain, unchanged
   */
  Statement build();
}
