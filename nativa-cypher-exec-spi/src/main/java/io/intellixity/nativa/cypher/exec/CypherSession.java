package io.intellixity.nativa.cypher.exec;

/**
 * One session against the database.
 * <p>
 * Each transaction method commits when the work returns and rolls back when it throws; the exception
 * reaches the caller. Whether the backend retries transient failures is up to the backend.
 */
public interface CypherSession extends AutoCloseable {
  <T> T readTransaction(CypherWork<T> work);

  <T> T writeTransaction(CypherWork<T> work);

  @Override
  void close();
}
