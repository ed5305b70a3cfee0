package io.intellixity.nativa.cypher.pattern;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.expr.*;

import java.util.*;

/**
 * {@code (alias:`Label` {key: value})}.
 * <p>
 * Copy-on-write: every {@code with*}/{@code named} call returns a new node and leaves this one untouched.
 */
public final class NodePattern implements PatternElement {
  private final List<String> labels;
  private final String alias;
  private final Map<String, Expression> properties;

  public NodePattern(List<String> labels, String alias, Map<String, Expression> properties) {
    List<String> ls = new ArrayList<>();
    if (labels != null) {
      for (String l : labels) ls.add(CypherConstructionException.requireText(l, "Node", "label"));
    }
    this.labels = List.copyOf(ls);
    this.alias = (alias == null || alias.isEmpty()) ? null : alias;
    this.properties = new MapExpression(properties).entries();
  }

  public List<String> labels() { return labels; }
  @Override public String alias() { return alias; }
  public Map<String, Expression> properties() { return properties; }

  /** Names this node. The alias is set once: renaming a named node to something else fails. */
  public NodePattern named(String newAlias) {
    CypherConstructionException.requireText(newAlias, "Node", "alias");
    if (alias != null && !alias.equals(newAlias)) {
      throw new CypherConstructionException("Node", "alias already set to '" + alias + "', cannot rename to '" + newAlias + "'");
    }
    return new NodePattern(labels, newAlias, properties);
  }

  public NodePattern withLabels(String... more) {
    List<String> ls = new ArrayList<>(labels);
    if (more != null) ls.addAll(Arrays.asList(more));
    return new NodePattern(ls, alias, properties);
  }

  /** Adds (or overrides) properties; values are expressions. */
  public NodePattern withProperties(Map<String, Expression> more) {
    Map<String, Expression> ps = new LinkedHashMap<>(properties);
    if (more != null) ps.putAll(more);
    return new NodePattern(labels, alias, ps);
  }

  /** Adds (or overrides) properties from raw values, coercing each one. */
  public NodePattern withProps(Map<String, ?> more) {
    return withProperties(more == null ? null : Expressions.mapOf(more).entries());
  }

  public NodePattern withProperty(String key, Object value) {
    Map<String, Expression> ps = new LinkedHashMap<>(properties);
    ps.put(key, Expressions.valueOf(value));
    return new NodePattern(labels, alias, ps);
  }

  public PropertyExpression property(String name) { return new PropertyExpression(this, name); }

  public RelationshipPattern relationshipTo(NodePattern other, String... types) {
    return RelationshipPattern.between(this, other, Direction.OUTGOING, types);
  }

  public RelationshipPattern relationshipFrom(NodePattern other, String... types) {
    return RelationshipPattern.between(this, other, Direction.INCOMING, types);
  }

  public RelationshipPattern relationshipBetween(NodePattern other, String... types) {
    return RelationshipPattern.between(this, other, Direction.BIDIRECTIONAL, types);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NodePattern n)) return false;
    return labels.equals(n.labels) && Objects.equals(alias, n.alias) && properties.equals(n.properties);
  }

  @Override
  public int hashCode() { return Objects.hash(labels, alias, properties); }

  @Override
  public String toString() { return "Node[" + render() + "]"; }
}
