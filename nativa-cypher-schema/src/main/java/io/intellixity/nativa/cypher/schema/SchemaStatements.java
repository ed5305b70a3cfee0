package io.intellixity.nativa.cypher.schema;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.render.ExpressionRenderer;
import io.intellixity.nativa.cypher.render.Identifiers;
import io.intellixity.nativa.cypher.statement.Statement;

import java.util.*;

/**
 * DDL statements for constraints and indexes (Neo4j 4.4+ syntax).
 * <p>
 * Names, labels, types and property keys are written as plain identifiers and backtick-quoted only when they
 * are not. None of these statements carries parameters.
 */
public final class SchemaStatements {
  private SchemaStatements() {}

  /** {@code CREATE CONSTRAINT name IF NOT EXISTS FOR (n:Label) REQUIRE (n.a, n.b) IS NODE KEY} */
  public static Statement createNodeKeyConstraint(String name, String label, String... properties) {
    List<String> props = properties("node key constraint", properties);
    return Statement.of("CREATE CONSTRAINT " + identifier(name, "constraint name")
        + " IF NOT EXISTS FOR " + nodeTarget(label)
        + " REQUIRE (" + qualified("n", props) + ") IS NODE KEY");
  }

  public static Statement createUniqueConstraint(String name, String label, String property) {
    return Statement.of("CREATE CONSTRAINT " + identifier(name, "constraint name")
        + " IF NOT EXISTS FOR " + nodeTarget(label)
        + " REQUIRE n." + identifier(property, "property") + " IS UNIQUE");
  }

  public static Statement createExistsConstraint(String name, String label, String property) {
    return Statement.of("CREATE CONSTRAINT " + identifier(name, "constraint name")
        + " IF NOT EXISTS FOR " + nodeTarget(label)
        + " REQUIRE n." + identifier(property, "property") + " IS NOT NULL");
  }

  /** {@code CREATE CONSTRAINT name IF NOT EXISTS FOR ()-[r:TYPE]-() REQUIRE r.p IS NOT NULL} */
  public static Statement createRelationshipExistsConstraint(String name, String type, String property) {
    return Statement.of("CREATE CONSTRAINT " + identifier(name, "constraint name")
        + " IF NOT EXISTS FOR ()-[r:" + identifier(type, "relationship type") + "]-()"
        + " REQUIRE r." + identifier(property, "property") + " IS NOT NULL");
  }

  public static Statement createIndex(String name, String label, String... properties) {
    List<String> props = properties("index", properties);
    return Statement.of("CREATE INDEX " + identifier(name, "index name")
        + " IF NOT EXISTS FOR " + nodeTarget(label)
        + " ON (" + qualified("n", props) + ")");
  }

  /** {@code CALL db.index.fulltext.createNodeIndex('name', ['Label'], ['prop'])} */
  public static Statement createFullTextIndex(String name, List<String> labels, List<String> properties) {
    CypherConstructionException.requireText(name, "Schema", "index name");
    if (labels == null || labels.isEmpty()) {
      throw new CypherConstructionException("Schema", "at least one label is required for a full-text index");
    }
    List<String> props = properties("full-text index", properties == null ? null : properties.toArray(new String[0]));
    return Statement.of("CALL db.index.fulltext.createNodeIndex(" + ExpressionRenderer.quote(name)
        + ", " + stringList(labels, "label") + ", " + stringList(props, "property") + ")");
  }

  public static Statement dropConstraint(String name) {
    return Statement.of("DROP CONSTRAINT " + identifier(name, "constraint name") + " IF EXISTS");
  }

  public static Statement dropIndex(String name) {
    return Statement.of("DROP INDEX " + identifier(name, "index name") + " IF EXISTS");
  }

  public static Statement showConstraints() { return Statement.of("SHOW CONSTRAINTS"); }

  public static Statement showIndexes() { return Statement.of("SHOW INDEXES"); }

  // ---------- helpers ----------

  private static String nodeTarget(String label) {
    return "(n:" + identifier(label, "label") + ")";
  }

  private static String identifier(String value, String what) {
    return Identifiers.quoteIfNeeded(CypherConstructionException.requireText(value, "Schema", what));
  }

  private static List<String> properties(String target, String[] properties) {
    if (properties == null || properties.length == 0) {
      throw new CypherConstructionException("Schema", "at least one property is required for a " + target);
    }
    for (String p : properties) CypherConstructionException.requireText(p, "Schema", "property");
    return List.of(properties);
  }

  private static String qualified(String variable, List<String> properties) {
    StringJoiner sj = new StringJoiner(", ");
    for (String p : properties) sj.add(variable + "." + Identifiers.quoteIfNeeded(p));
    return sj.toString();
  }

  private static String stringList(List<String> values, String what) {
    StringJoiner sj = new StringJoiner(", ", "[", "]");
    for (String v : values) sj.add(ExpressionRenderer.quote(CypherConstructionException.requireText(v, "Schema", what)));
    return sj.toString();
  }
}
