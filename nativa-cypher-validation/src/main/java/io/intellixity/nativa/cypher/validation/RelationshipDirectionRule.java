package io.intellixity.nativa.cypher.validation;

import java.util.regex.Pattern;

/** In a MATCH, {@code (a)-[r]-(b)} is legal but often an accidental undirected traversal. */
public final class RelationshipDirectionRule implements ValidationRule {
  public static final String ID = "MISSING_RELATIONSHIP_DIRECTION";

  private static final Pattern MATCH = Pattern.compile("\\bMATCH\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern UNDIRECTED = Pattern.compile("\\)-\\[[^\\]]+\\]-\\(");

  @Override public String id() { return ID; }
  @Override public String description() { return "Missing or ambiguous relationship direction"; }
  @Override public ValidationLevel level() { return ValidationLevel.STRICT; }

  @Override
  public ValidationError check(String cypher, String masked) {
    if (MATCH.matcher(masked).find() && UNDIRECTED.matcher(masked).find()) {
      return new ValidationError(ID, "relationship without direction found, consider using -> or <-");
    }
    return null;
  }
}
