package io.intellixity.nativa.cypher.schema;

import io.intellixity.nativa.cypher.CypherConstructionException;
import io.intellixity.nativa.cypher.expr.PropertyExpression;
import io.intellixity.nativa.cypher.expr.Variable;
import io.intellixity.nativa.cypher.pattern.PatternElement;

/** A property declared on an {@link EntitySchema}. */
public record SchemaProperty(String name, String label) {
  /** Alias used when the node passed to {@link #of(PatternElement)} has none. */
  public static final String DEFAULT_ALIAS = "n";

  public SchemaProperty {
    CypherConstructionException.requireText(name, "SchemaProperty", "name");
    CypherConstructionException.requireText(label, "SchemaProperty", "label");
  }

  /** {@code alias.name} for the given node; an anonymous node is addressed as {@code n}. */
  public PropertyExpression of(PatternElement node) {
    CypherConstructionException.requirePresent(node, "SchemaProperty", "node");
    if (node.hasAlias()) return new PropertyExpression(node, name);
    return new PropertyExpression(new Variable(DEFAULT_ALIAS), name);
  }
}
