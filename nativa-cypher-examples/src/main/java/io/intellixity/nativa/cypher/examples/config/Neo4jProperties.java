package io.intellixity.nativa.cypher.examples.config;

import io.intellixity.nativa.cypher.neo4j.Neo4jSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nativa.neo4j")
public class Neo4jProperties {
  private String uri;
  private String user;
  private String password;

  /** Optional database name; server default when absent. */
  private String database;

  public String getUri() { return uri; }
  public void setUri(String uri) { this.uri = uri; }
  public String getUser() { return user; }
  public void setUser(String user) { this.user = user; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  public String getDatabase() { return database; }
  public void setDatabase(String database) { this.database = database; }

  public Neo4jSettings toSettings() {
    return new Neo4jSettings(uri, user, password, database);
  }
}
