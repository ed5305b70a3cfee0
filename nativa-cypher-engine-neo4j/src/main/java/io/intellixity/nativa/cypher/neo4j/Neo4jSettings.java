package io.intellixity.nativa.cypher.neo4j;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;

import java.util.*;

/**
 * Connection settings: {@code nativa.neo4j.uri}, {@code nativa.neo4j.user}, {@code nativa.neo4j.password},
 * {@code nativa.neo4j.database}. Environment variables ({@code NATIVA_NEO4J_URI}, ...) override properties,
 * system properties override both.
 */
public record Neo4jSettings(String uri, String user, String password, String database) {
  public static final String URI = "nativa.neo4j.uri";
  public static final String USER = "nativa.neo4j.user";
  public static final String PASSWORD = "nativa.neo4j.password";
  public static final String DATABASE = "nativa.neo4j.database";

  public Neo4jSettings {
    uri = blankToNull(uri);
    user = blankToNull(user);
    database = blankToNull(database);
  }

  public static Neo4jSettings fromProperties(Properties p) {
    return load(p, Map.of(), new Properties());
  }

  public static Neo4jSettings load(Properties base, Map<String, String> env, Properties system) {
    Map<String, String> v = new HashMap<>();
    for (String key : List.of(URI, USER, PASSWORD, DATABASE)) {
      String s = (base == null) ? null : base.getProperty(key);
      String fromEnv = (env == null) ? null : env.get(key.toUpperCase(Locale.ROOT).replace('.', '_'));
      if (fromEnv != null) s = fromEnv;
      String fromSystem = (system == null) ? null : system.getProperty(key);
      if (fromSystem != null) s = fromSystem;
      v.put(key, s);
    }
    return new Neo4jSettings(v.get(URI), v.get(USER), v.get(PASSWORD), v.get(DATABASE));
  }

  public boolean isConfigured() { return uri != null; }

  /** New driver; basic auth when a user is set, none otherwise. The caller closes it. */
  public Driver createDriver() {
    if (uri == null) throw new IllegalStateException(URI + " is not set");
    return (user == null)
        ? GraphDatabase.driver(uri, AuthTokens.none())
        : GraphDatabase.driver(uri, AuthTokens.basic(user, password == null ? "" : password));
  }

  @Override
  public String toString() {
    return "Neo4jSettings[uri=" + uri + ", user=" + user + ", password=" + (password == null ? "null" : "***")
        + ", database=" + database + "]";
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }
}
