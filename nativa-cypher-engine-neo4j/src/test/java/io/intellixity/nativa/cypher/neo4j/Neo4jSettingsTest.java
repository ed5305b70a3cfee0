package io.intellixity.nativa.cypher.neo4j;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class Neo4jSettingsTest {

  @Test
  void readsAllKeysFromProperties() {
    Properties p = new Properties();
    p.setProperty(Neo4jSettings.URI, "bolt://localhost:7687");
    p.setProperty(Neo4jSettings.USER, "neo4j");
    p.setProperty(Neo4jSettings.PASSWORD, "secret");
    p.setProperty(Neo4jSettings.DATABASE, "movies");

    Neo4jSettings s = Neo4jSettings.fromProperties(p);

    assertEquals("bolt://localhost:7687", s.uri());
    assertEquals("neo4j", s.user());
    assertEquals("secret", s.password());
    assertEquals("movies", s.database());
    assertTrue(s.isConfigured());
  }

  @Test
  void environmentThenSystemPropertiesOverride() {
    Properties base = new Properties();
    base.setProperty(Neo4jSettings.URI, "bolt://base:7687");
    base.setProperty(Neo4jSettings.USER, "base");
    Properties system = new Properties();
    system.setProperty(Neo4jSettings.URI, "bolt://system:7687");

    Neo4jSettings s = Neo4jSettings.load(base,
        Map.of("NATIVA_NEO4J_URI", "bolt://env:7687", "NATIVA_NEO4J_USER", "env"), system);

    assertEquals("bolt://system:7687", s.uri());
    assertEquals("env", s.user());
  }

  @Test
  void blankValuesAreUnset() {
    Neo4jSettings s = new Neo4jSettings("  ", "", null, " ");
    assertNull(s.uri());
    assertNull(s.user());
    assertNull(s.database());
    assertFalse(s.isConfigured());
    assertThrows(IllegalStateException.class, s::createDriver);
  }

  @Test
  void toStringMasksPassword() {
    String text = new Neo4jSettings("bolt://localhost:7687", "neo4j", "secret", null).toString();
    assertFalse(text.contains("secret"));
    assertTrue(text.contains("***"));
  }
}
