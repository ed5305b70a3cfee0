package io.intellixity.nativa.cypher.exec;

import io.intellixity.nativa.cypher.CypherException;
import io.intellixity.nativa.cypher.statement.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs built {@link Statement}s through a {@link CypherSessionFactory}.
 * <p>
 * One session per call, closed before returning. Failures from the backend are wrapped in
 * {@link CypherExecutionException}; a {@link CypherException} (e.g. from the {@link StatementCheck}) passes
 * through unchanged.
 */
public final class CypherExecutor {
  private static final Logger log = LoggerFactory.getLogger(CypherExecutor.class);

  private final CypherSessionFactory sessions;
  private final StatementCheck check;

  public CypherExecutor(CypherSessionFactory sessions) {
    this(sessions, StatementCheck.NONE);
  }

  public CypherExecutor(CypherSessionFactory sessions, StatementCheck check) {
    this.sessions = Objects.requireNonNull(sessions, "sessions");
    this.check = (check == null) ? StatementCheck.NONE : check;
  }

  public CypherResult executeRead(Statement statement) {
    checked(statement);
    long start = System.nanoTime();
    CypherResult r = read(tx -> runLogged("READ", tx, statement));
    debugDone("READ", 1, r, System.nanoTime() - start);
    return r;
  }

  public CypherResult executeWrite(Statement statement) {
    checked(statement);
    long start = System.nanoTime();
    CypherResult r = write(tx -> runLogged("WRITE", tx, statement));
    debugDone("WRITE", 1, r, System.nanoTime() - start);
    return r;
  }

  /**
   * Runs all statements, in order, in one write transaction. Every statement is checked before the
   * transaction opens; the first failing statement aborts the transaction and its failure is thrown.
   */
  public List<CypherResult> executeBatchWrite(List<Statement> statements) {
    Objects.requireNonNull(statements, "statements");
    if (statements.isEmpty()) return List.of();
    for (Statement s : statements) checked(s);

    long start = System.nanoTime();
    List<CypherResult> out = write(tx -> {
      List<CypherResult> results = new ArrayList<>(statements.size());
      for (Statement s : statements) results.add(runLogged("BATCH_WRITE", tx, s));
      return results;
    });
    debugDone("BATCH_WRITE", statements.size(), out.isEmpty() ? null : out.get(out.size() - 1), System.nanoTime() - start);
    return List.copyOf(out);
  }

  /** Arbitrary read work in one transaction. */
  public <T> T read(CypherWork<T> work) {
    Objects.requireNonNull(work, "work");
    try (CypherSession session = sessions.openSession()) {
      return session.readTransaction(work);
    } catch (CypherException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CypherExecutionException("read transaction failed: " + e.getMessage(), e);
    }
  }

  /** Arbitrary write work in one transaction. */
  public <T> T write(CypherWork<T> work) {
    Objects.requireNonNull(work, "work");
    try (CypherSession session = sessions.openSession()) {
      return session.writeTransaction(work);
    } catch (CypherException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CypherExecutionException("write transaction failed: " + e.getMessage(), e);
    }
  }

  private void checked(Statement statement) {
    Objects.requireNonNull(statement, "statement");
    check.check(statement);
  }

  private static CypherResult runLogged(String op, CypherRunner tx, Statement s) {
    debugCypher(op, s);
    CypherResult r = tx.run(s.cypher(), s.params());
    return (r == null) ? CypherResult.empty() : r;
  }

  private static void debugCypher(String op, Statement s) {
    if (!log.isDebugEnabled()) return;
    log.debug("nativa.cypher.exec op={} paramCount={} cypher={}", op, s.params().size(), s.cypher());

    // TRACE: names and value types only, never values
    if (log.isTraceEnabled()) {
      for (Map.Entry<String, Object> e : s.params().entrySet()) {
        Object v = e.getValue();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("nativa.cypher.exec param name={} valueType={} valueLen={}", e.getKey(), vType, vLen);
      }
    }
  }

  private static void debugDone(String op, int statements, CypherResult last, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("nativa.cypher.exec_done op={} statements={} durationMs={} records={} counters={}",
        op, statements, durationNanos / 1_000_000.0,
        last == null ? 0 : last.size(),
        last == null ? Map.of() : last.counters());
  }
}
