package io.intellixity.nativa.cypher.neo4j;

import io.intellixity.nativa.cypher.exec.CypherExecutionException;
import io.intellixity.nativa.cypher.exec.CypherResult;
import io.intellixity.nativa.cypher.exec.CypherRunner;
import io.intellixity.nativa.cypher.exec.CypherSession;
import io.intellixity.nativa.cypher.exec.CypherWork;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.summary.SummaryCounters;

import java.util.*;

/**
 * {@link CypherSession} backed by a driver {@link Session}.
 * <p>
 * Work runs in the driver's transaction functions, so the driver decides about retries of transient
 * failures. Results are fully consumed inside the transaction.
 */
final class Neo4jCypherSession implements CypherSession {
  private final Session session;

  Neo4jCypherSession(Session session) {
    this.session = session;
  }

  @Override
  public <T> T readTransaction(CypherWork<T> work) {
    try {
      return session.readTransaction(tx -> work.execute(runner(tx)));
    } catch (Neo4jException e) {
      throw translate(e);
    }
  }

  @Override
  public <T> T writeTransaction(CypherWork<T> work) {
    try {
      return session.writeTransaction(tx -> work.execute(runner(tx)));
    } catch (Neo4jException e) {
      throw translate(e);
    }
  }

  @Override
  public void close() {
    session.close();
  }

  private static CypherRunner runner(Transaction tx) {
    return (cypher, params) -> {
      Result result = tx.run(cypher, params == null ? Map.of() : params);
      List<Map<String, Object>> records = new ArrayList<>();
      for (Record r : result.list()) records.add(r.asMap());
      return new CypherResult(records, countersOf(result.consume().counters()));
    };
  }

  static Map<String, Object> countersOf(SummaryCounters c) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (c == null) return out;
    putNonZero(out, "nodesCreated", c.nodesCreated());
    putNonZero(out, "nodesDeleted", c.nodesDeleted());
    putNonZero(out, "relationshipsCreated", c.relationshipsCreated());
    putNonZero(out, "relationshipsDeleted", c.relationshipsDeleted());
    putNonZero(out, "propertiesSet", c.propertiesSet());
    putNonZero(out, "labelsAdded", c.labelsAdded());
    putNonZero(out, "labelsRemoved", c.labelsRemoved());
    putNonZero(out, "indexesAdded", c.indexesAdded());
    putNonZero(out, "indexesRemoved", c.indexesRemoved());
    putNonZero(out, "constraintsAdded", c.constraintsAdded());
    putNonZero(out, "constraintsRemoved", c.constraintsRemoved());
    putNonZero(out, "systemUpdates", c.systemUpdates());
    return out;
  }

  private static void putNonZero(Map<String, Object> out, String name, int value) {
    if (value != 0) out.put(name, value);
  }

  private static CypherExecutionException translate(Neo4jException e) {
    String code = e.code();
    String msg = (code == null || code.isBlank()) ? e.getMessage() : code + " " + e.getMessage();
    return new CypherExecutionException(msg, e);
  }
}
