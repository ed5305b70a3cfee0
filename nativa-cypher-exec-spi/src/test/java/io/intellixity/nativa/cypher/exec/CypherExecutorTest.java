package io.intellixity.nativa.cypher.exec;

import io.intellixity.nativa.cypher.CypherException;
import io.intellixity.nativa.cypher.statement.Statement;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class CypherExecutorTest {

  @Test
  void executeReadUsesReadTransactionAndClosesSession() {
    FakeSessions sessions = new FakeSessions();
    sessions.reply("MATCH (p:`Person`) RETURN p.name AS name", new CypherResult(
        List.of(Map.of("name", "Tom Hanks")), Map.of()));

    CypherResult r = new CypherExecutor(sessions).executeRead(
        Statement.of("MATCH (p:`Person`) RETURN p.name AS name"));

    assertEquals("Tom Hanks", r.value("name"));
    assertEquals(List.of("READ"), sessions.modes);
    assertEquals(1, sessions.opened);
    assertEquals(1, sessions.closed);
  }

  @Test
  void executeWritePassesParams() {
    FakeSessions sessions = new FakeSessions();
    Statement s = Statement.of("CREATE (p:`Person` {name: $name})", Map.of("name", "Keanu"));

    CypherResult r = new CypherExecutor(sessions).executeWrite(s);

    assertTrue(r.isEmpty());
    assertEquals(List.of("WRITE"), sessions.modes);
    assertEquals(List.of(s), sessions.runs);
    assertEquals(1, sessions.closed);
  }

  @Test
  void batchRunsInOrderInOneWriteTransaction() {
    FakeSessions sessions = new FakeSessions();
    List<Statement> batch = List.of(Statement.of("CREATE (a)"), Statement.of("CREATE (b)"), Statement.of("CREATE (c)"));

    List<CypherResult> results = new CypherExecutor(sessions).executeBatchWrite(batch);

    assertEquals(3, results.size());
    assertEquals(batch, sessions.runs);
    assertEquals(List.of("WRITE"), sessions.modes);
    assertEquals(1, sessions.committed);
  }

  @Test
  void batchAbortsOnFirstFailure() {
    FakeSessions sessions = new FakeSessions();
    sessions.failOn("CREATE (b)", new IllegalStateException("constraint violated"));
    List<Statement> batch = List.of(Statement.of("CREATE (a)"), Statement.of("CREATE (b)"), Statement.of("CREATE (c)"));

    CypherExecutionException e = assertThrows(CypherExecutionException.class,
        () -> new CypherExecutor(sessions).executeBatchWrite(batch));

    assertEquals(CypherException.Kind.EXECUTION, e.kind());
    assertEquals("Executor", e.component());
    assertTrue(e.getMessage().contains("constraint violated"));
    assertInstanceOf(IllegalStateException.class, e.getCause());
    assertEquals(List.of(Statement.of("CREATE (a)"), Statement.of("CREATE (b)")), sessions.runs);
    assertEquals(0, sessions.committed);
    assertEquals(1, sessions.rolledBack);
    assertEquals(1, sessions.closed);
  }

  @Test
  void emptyBatchOpensNoSession() {
    FakeSessions sessions = new FakeSessions();
    assertEquals(List.of(), new CypherExecutor(sessions).executeBatchWrite(List.of()));
    assertEquals(0, sessions.opened);
  }

  @Test
  void checkRejectsBeforeAnySessionOpens() {
    FakeSessions sessions = new FakeSessions();
    StatementCheck noDelete = s -> {
      if (s.cypher().contains("DELETE")) {
        throw new CypherException(CypherException.Kind.VALIDATION, "Validator", "DELETE not allowed");
      }
    };
    CypherExecutor executor = new CypherExecutor(sessions, noDelete);

    CypherException e = assertThrows(CypherException.class, () -> executor.executeBatchWrite(List.of(
        Statement.of("CREATE (a)"), Statement.of("MATCH (n) DELETE n"))));

    assertEquals(CypherException.Kind.VALIDATION, e.kind());
    assertEquals(0, sessions.opened);
    assertTrue(sessions.runs.isEmpty());
  }

  @Test
  void cypherExceptionsFromBackendPassThrough() {
    FakeSessions sessions = new FakeSessions();
    CypherExecutionException original = new CypherExecutionException("boom", null);
    sessions.failOn("RETURN 1", original);

    CypherExecutionException e = assertThrows(CypherExecutionException.class,
        () -> new CypherExecutor(sessions).executeRead(Statement.of("RETURN 1")));
    assertSame(original, e);
  }

  @Test
  void genericWorkRunsInRequestedMode() {
    FakeSessions sessions = new FakeSessions();
    CypherExecutor executor = new CypherExecutor(sessions);

    Integer n = executor.read(tx -> {
      tx.run(Statement.of("RETURN 1"));
      tx.run(Statement.of("RETURN 2"));
      return 2;
    });

    assertEquals(2, n);
    assertEquals(List.of("READ"), sessions.modes);
    assertEquals(2, sessions.runs.size());
  }

  @Test
  void nullFactoryRejected() {
    assertThrows(NullPointerException.class, () -> new CypherExecutor(null));
  }

  private static final class FakeSessions implements CypherSessionFactory {
    final List<Statement> runs = new ArrayList<>();
    final List<String> modes = new ArrayList<>();
    final Map<String, CypherResult> replies = new HashMap<>();
    final Map<String, RuntimeException> failures = new HashMap<>();
    int opened;
    int closed;
    int committed;
    int rolledBack;

    void reply(String cypher, CypherResult result) { replies.put(cypher, result); }

    void failOn(String cypher, RuntimeException e) { failures.put(cypher, e); }

    @Override
    public CypherSession openSession() {
      opened++;
      return new FakeSession();
    }

    private final class FakeSession implements CypherSession {
      @Override
      public <T> T readTransaction(CypherWork<T> work) { return inTx("READ", work); }

      @Override
      public <T> T writeTransaction(CypherWork<T> work) { return inTx("WRITE", work); }

      private <T> T inTx(String mode, CypherWork<T> work) {
        modes.add(mode);
        try {
          T out = work.execute((cypher, params) -> {
            runs.add(Statement.of(cypher, params));
            RuntimeException f = failures.get(cypher);
            if (f != null) throw f;
            return replies.getOrDefault(cypher, CypherResult.empty());
          });
          committed++;
          return out;
        } catch (RuntimeException e) {
          rolledBack++;
          throw e;
        }
      }

      @Override
      public void close() { closed++; }
    }
  }
}
