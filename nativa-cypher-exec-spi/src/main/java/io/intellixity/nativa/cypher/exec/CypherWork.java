package io.intellixity.nativa.cypher.exec;

/** Unit of work executed inside one transaction. */
@FunctionalInterface
public interface CypherWork<T> {
  T execute(CypherRunner tx);
}
