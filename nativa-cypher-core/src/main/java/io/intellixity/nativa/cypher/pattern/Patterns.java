package io.intellixity.nativa.cypher.pattern;

import io.intellixity.nativa.cypher.CypherConstructionException;

import java.util.*;

/** Static factories for node, relationship and path patterns. */
public final class Patterns {
  private Patterns() {}

  public static NodePattern node(String... labels) {
    return new NodePattern(labels == null ? List.of() : Arrays.asList(labels), null, null);
  }

  public static NodePattern anyNode() { return new NodePattern(List.of(), null, null); }

  public static NodePattern anyNode(String alias) { return anyNode().named(alias); }

  public static PatternPath path(PatternElement... elements) {
    return new PatternPath(elements == null ? List.of() : Arrays.asList(elements), null);
  }

  /**
   * {@code (start)-[r1]->(end1)-[r2]->(end2)...}: each relationship contributes its arrow and end node.
   * Relationships are rendered in the given order regardless of their own start node.
   */
  public static PatternPath chain(NodePattern start, RelationshipPattern... relationships) {
    CypherConstructionException.requirePresent(start, "chain", "start node");
    List<PatternElement> elements = new ArrayList<>();
    elements.add(start);
    if (relationships != null) {
      for (RelationshipPattern r : relationships) {
        CypherConstructionException.requirePresent(r, "chain", "relationship");
        elements.add(r);
        elements.add(r.end());
      }
    }
    return new PatternPath(elements, null);
  }

  /**
   * Outgoing hops from alternating type/node arguments:
   * {@code complexPath(user, "WORKS_FOR", company, "LOCATED_IN", city)}.
   */
  public static PatternPath complexPath(NodePattern start, Object... typesAndNodes) {
    CypherConstructionException.requirePresent(start, "complexPath", "start node");
    if (typesAndNodes == null || typesAndNodes.length < 2 || typesAndNodes.length % 2 != 0) {
      throw new CypherConstructionException("complexPath", "expected alternating relationship type and node arguments");
    }
    List<PatternElement> elements = new ArrayList<>();
    elements.add(start);
    NodePattern current = start;
    for (int i = 0; i < typesAndNodes.length; i += 2) {
      if (!(typesAndNodes[i] instanceof String type)) {
        throw new CypherConstructionException("complexPath", "argument " + (i + 1) + " must be a relationship type");
      }
      if (!(typesAndNodes[i + 1] instanceof NodePattern next)) {
        throw new CypherConstructionException("complexPath", "argument " + (i + 2) + " must be a node pattern");
      }
      elements.add(current.relationshipTo(next, type));
      elements.add(next);
      current = next;
    }
    return new PatternPath(elements, null);
  }
}
