package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

/** Text inserted verbatim. Nothing in it is escaped or parameterized. */
public record RawCypher(String text) implements Expression {
  public RawCypher {
    CypherConstructionException.requirePresent(text, "RawCypher", "text");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
