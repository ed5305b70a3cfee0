package io.intellixity.nativa.cypher.pattern;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.expr.*;

import java.util.*;

/**
 * Relationship between two node patterns. The start and end nodes are shared references; a path that
 * contains this relationship decides traversal order.
 */
public final class RelationshipPattern implements PatternElement {
  private final NodePattern start;
  private final NodePattern end;
  private final Direction direction;
  private final List<String> types;
  private final String alias;
  private final Map<String, Expression> properties;
  private final Integer minHops;
  private final Integer maxHops;
  private final boolean variableLength;

  public RelationshipPattern(NodePattern start,
                             NodePattern end,
                             Direction direction,
                             List<String> types,
                             String alias,
                             Map<String, Expression> properties,
                             Integer minHops,
                             Integer maxHops,
                             boolean variableLength) {
    this.start = CypherConstructionException.requirePresent(start, "Relationship", "start node");
    this.end = CypherConstructionException.requirePresent(end, "Relationship", "end node");
    this.direction = (direction == null) ? Direction.OUTGOING : direction;
    List<String> ts = new ArrayList<>();
    if (types != null) {
      for (String t : types) ts.add(CypherConstructionException.requireText(t, "Relationship", "type"));
    }
    this.types = List.copyOf(ts);
    this.alias = (alias == null || alias.isEmpty()) ? null : alias;
    this.properties = new MapExpression(properties).entries();
    if (minHops != null && minHops < 0) throw new CypherConstructionException("Relationship", "minHops must be >= 0");
    if (maxHops != null && maxHops < 0) throw new CypherConstructionException("Relationship", "maxHops must be >= 0");
    if (minHops != null && maxHops != null && maxHops < minHops) {
      throw new CypherConstructionException("Relationship", "maxHops " + maxHops + " is below minHops " + minHops);
    }
    this.minHops = minHops;
    this.maxHops = maxHops;
    this.variableLength = variableLength || minHops != null || maxHops != null;
  }

  static RelationshipPattern between(NodePattern start, NodePattern end, Direction direction, String... types) {
    return new RelationshipPattern(start, end, direction,
        types == null ? List.of() : Arrays.asList(types), null, null, null, null, false);
  }

  public NodePattern start() { return start; }
  public NodePattern end() { return end; }
  public Direction direction() { return direction; }
  public List<String> types() { return types; }
  @Override public String alias() { return alias; }
  public Map<String, Expression> properties() { return properties; }
  public Integer minHops() { return minHops; }
  public Integer maxHops() { return maxHops; }
  public boolean variableLength() { return variableLength; }

  public RelationshipPattern named(String newAlias) {
    CypherConstructionException.requireText(newAlias, "Relationship", "alias");
    if (alias != null && !alias.equals(newAlias)) {
      throw new CypherConstructionException("Relationship", "alias already set to '" + alias + "', cannot rename to '" + newAlias + "'");
    }
    return copy(newAlias, properties, minHops, maxHops, variableLength);
  }

  public RelationshipPattern withProperties(Map<String, Expression> more) {
    Map<String, Expression> ps = new LinkedHashMap<>(properties);
    if (more != null) ps.putAll(more);
    return copy(alias, ps, minHops, maxHops, variableLength);
  }

  public RelationshipPattern withProps(Map<String, ?> more) {
    return withProperties(more == null ? null : Expressions.mapOf(more).entries());
  }

  /** Variable length {@code *min..max}; either bound may be null. */
  public RelationshipPattern length(Integer min, Integer max) {
    return copy(alias, properties, min, max, true);
  }

  public RelationshipPattern minHops(int min) { return length(min, maxHops); }

  public RelationshipPattern maxHops(int max) { return length(minHops, max); }

  /** Any number of hops: {@code *}. */
  public RelationshipPattern unbounded() { return copy(alias, properties, null, null, true); }

  public PropertyExpression property(String name) { return new PropertyExpression(this, name); }

  /** Continues the path from this relationship's end node. */
  public PatternPath relationshipTo(NodePattern next, String... types) {
    return continueWith(between(end, next, Direction.OUTGOING, types));
  }

  public PatternPath relationshipFrom(NodePattern next, String... types) {
    return continueWith(between(end, next, Direction.INCOMING, types));
  }

  public PatternPath relationshipBetween(NodePattern next, String... types) {
    return continueWith(between(end, next, Direction.BIDIRECTIONAL, types));
  }

  private PatternPath continueWith(RelationshipPattern next) {
    return new PatternPath(List.of(start, this, end, next, next.end()), null);
  }

  private RelationshipPattern copy(String a, Map<String, Expression> ps, Integer min, Integer max, boolean varLength) {
    return new RelationshipPattern(start, end, direction, types, a, ps, min, max, varLength);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RelationshipPattern r)) return false;
    return start.equals(r.start) && end.equals(r.end) && direction == r.direction && types.equals(r.types)
        && Objects.equals(alias, r.alias) && properties.equals(r.properties)
        && Objects.equals(minHops, r.minHops) && Objects.equals(maxHops, r.maxHops) && variableLength == r.variableLength;
  }

  @Override
  public int hashCode() { return Objects.hash(start, end, direction, types, alias, properties, minHops, maxHops, variableLength); }

  @Override
  public String toString() { return "Relationship[" + render() + "]"; }
}
