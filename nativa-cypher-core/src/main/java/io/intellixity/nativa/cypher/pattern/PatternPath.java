package io.intellixity.nativa.cypher.pattern;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.expr.ExpressionVisitor;

import java.util.*;

/** Ordered nodes and relationships, optionally named ({@code p = (a)-[]->(b)}). */
public final class PatternPath implements PatternElement {
  private final List<PatternElement> elements;
  private final String alias;

  public PatternPath(List<? extends PatternElement> elements, String alias) {
    if (elements == null || elements.isEmpty()) {
      throw new CypherConstructionException("Path", "at least one pattern element is required");
    }
    List<PatternElement> out = new ArrayList<>();
    for (PatternElement e : elements) {
      CypherConstructionException.requirePresent(e, "Path", "element");
      if (e instanceof PatternPath nested) {
        if (nested.hasAlias()) throw new CypherConstructionException("Path", "named path '" + nested.alias() + "' cannot be nested");
        out.addAll(nested.elements());
      } else {
        out.add(e);
      }
    }
    this.elements = List.copyOf(out);
    this.alias = (alias == null || alias.isEmpty()) ? null : alias;
  }

  public List<PatternElement> elements() { return elements; }
  @Override public String alias() { return alias; }

  public PatternPath named(String newAlias) {
    CypherConstructionException.requireText(newAlias, "Path", "alias");
    return new PatternPath(elements, newAlias);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return (o instanceof PatternPath p) && elements.equals(p.elements) && Objects.equals(alias, p.alias);
  }

  @Override
  public int hashCode() { return Objects.hash(elements, alias); }

  @Override
  public String toString() { return "Path[" + render() + "]"; }
}
