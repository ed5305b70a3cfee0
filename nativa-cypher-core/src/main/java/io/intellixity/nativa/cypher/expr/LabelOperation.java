package io.intellixity.nativa.cypher.expr;

import io.intellixity.nativa.cypher.CypherConstructionException;

import java.util.List;

/** Label item for SET/REMOVE: {@code p:`Admin`:`Active`}. */
public record LabelOperation(Expression subject, List<String> labels) implements Expression {
  public LabelOperation {
    CypherConstructionException.requirePresent(subject, "LabelOperation", "subject");
    if (labels == null || labels.isEmpty()) throw new CypherConstructionException("LabelOperation", "at least one label is required");
    for (String l : labels) CypherConstructionException.requireText(l, "LabelOperation", "label");
    labels = List.copyOf(labels);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
