package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

import java.util.*;

/** Map literal {@code {k: v, ...}}; entries keep insertion order. */
public record MapExpression(Map<String, Expression> entries) implements Expression {
  public MapExpression {
    Map<String, Expression> copy = new LinkedHashMap<>();
    if (entries != null) {
      for (Map.Entry<String, Expression> e : entries.entrySet()) {
        CypherConstructionException.requireText(e.getKey(), "Map", "key");
        copy.put(e.getKey(), CypherConstructionException.requirePresent(e.getValue(), "Map", "value of '" + e.getKey() + "'"));
      }
    }
    entries = Collections.unmodifiableMap(copy);
  }

  public boolean isEmpty() { return entries.isEmpty(); }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
