package io.intellixity.nativa.cypher.neo4j;

import io.intellixity.nativa.cypher.exec.CypherSession;
import io.intellixity.nativa.cypher.exec.CypherSessionFactory;
import org.neo4j.driver.AccessMode;
import org.neo4j.driver.Driver;
import org.neo4j.driver.SessionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * {@link CypherSessionFactory} over a Neo4j {@link Driver}.
 * <p>
 * The driver is owned by the caller and is never closed here.
 */
public final class Neo4jSessionFactory implements CypherSessionFactory {
  private static final Logger log = LoggerFactory.getLogger(Neo4jSessionFactory.class);

  private final Driver driver;
  private final String database;

  public Neo4jSessionFactory(Driver driver) {
    this(driver, null);
  }

  /** @param database target database, or null/blank for the server default */
  public Neo4jSessionFactory(Driver driver, String database) {
    this.driver = Objects.requireNonNull(driver, "driver");
    this.database = (database == null || database.isBlank()) ? null : database;
  }

  public String database() { return database; }

  @Override
  public CypherSession openSession() {
    if (log.isDebugEnabled()) {
      log.debug("nativa.cypher.neo4j session_open database={}", database == null ? "<default>" : database);
    }
    return new Neo4jCypherSession(driver.session(sessionConfig(AccessMode.WRITE)));
  }

  SessionConfig sessionConfig(AccessMode mode) {
    SessionConfig.Builder b = SessionConfig.builder().withDefaultAccessMode(mode);
    if (database != null) b = b.withDatabase(database);
    return b.build();
  }
}
