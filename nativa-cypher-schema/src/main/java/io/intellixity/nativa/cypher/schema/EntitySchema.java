package io.intellixity.nativa.cypher.schema;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.pattern.NodePattern;
import io.intellixity.nativa.cypher.pattern.Patterns;
import io.intellixity.nativa.cypher.statement.Statement;

import java.util.*;

/**
 * Declared shape of a node type: its labels and the properties queries may reference.
 * <p>
 * Immutable; {@link #withProperties(String...)} and {@link #withLabels(String...)} return new schemas.
 * Looking up an undeclared property fails, which catches typos before a statement is built.
 */
public record EntitySchema(String label, List<String> extraLabels, Map<String, SchemaProperty> properties) {
  public EntitySchema {
    CypherConstructionException.requireText(label, "EntitySchema", "label");
    List<String> ls = new ArrayList<>();
    if (extraLabels != null) {
      for (String l : extraLabels) ls.add(CypherConstructionException.requireText(l, "EntitySchema", "label"));
    }
    extraLabels = List.copyOf(ls);
    properties = Collections.unmodifiableMap(properties == null ? new LinkedHashMap<>() : new LinkedHashMap<>(properties));
  }

  public static EntitySchema of(String label) {
    return new EntitySchema(label, List.of(), Map.of());
  }

  public EntitySchema withLabels(String... labels) {
    List<String> ls = new ArrayList<>(extraLabels);
    if (labels != null) ls.addAll(Arrays.asList(labels));
    return new EntitySchema(label, ls, properties);
  }

  public EntitySchema withProperties(String... names) {
    Map<String, SchemaProperty> ps = new LinkedHashMap<>(properties);
    if (names != null) {
      for (String n : names) ps.put(n, new SchemaProperty(n, label));
    }
    return new EntitySchema(label, extraLabels, ps);
  }

  /** All labels, primary first. */
  public List<String> labels() {
    List<String> all = new ArrayList<>(extraLabels.size() + 1);
    all.add(label);
    all.addAll(extraLabels);
    return all;
  }

  public NodePattern node() {
    return Patterns.node(labels().toArray(new String[0]));
  }

  public NodePattern node(String alias) {
    return node().named(alias);
  }

  public SchemaProperty property(String name) {
    SchemaProperty p = properties.get(name);
    if (p == null) {
      throw new CypherConstructionException("EntitySchema", "unknown property '" + name + "' for label '" + label + "'");
    }
    return p;
  }

  public boolean hasProperty(String name) { return properties.containsKey(name); }

  /** Index on declared properties of the primary label. */
  public Statement index(String indexName, String... propertyNames) {
    return SchemaStatements.createIndex(indexName, label, declared(propertyNames));
  }

  public Statement uniqueConstraint(String constraintName, String propertyName) {
    return SchemaStatements.createUniqueConstraint(constraintName, label, property(propertyName).name());
  }

  public Statement nodeKeyConstraint(String constraintName, String... propertyNames) {
    return SchemaStatements.createNodeKeyConstraint(constraintName, label, declared(propertyNames));
  }

  private String[] declared(String... names) {
    if (names == null) return new String[0];
    for (String n : names) property(n);
    return names;
  }
}
