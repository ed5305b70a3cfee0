package io.intellixity.nativa.cypher.validation;

/** Every closing delimiter matches an earlier opening one and none is left open. */
public final class BalancedDelimiterRule implements ValidationRule {
  private final String id;
  private final char open;
  private final char close;
  private final String singular;
  private final String plural;

  public BalancedDelimiterRule(String id, char open, char close, String singular, String plural) {
    this.id = id;
    this.open = open;
    this.close = close;
    this.singular = singular;
    this.plural = plural;
  }

  @Override public String id() { return id; }
  @Override public String description() { return "Unmatched " + plural + " in query"; }
  @Override public ValidationLevel level() { return ValidationLevel.BASIC; }

  @Override
  public ValidationError check(String cypher, String masked) {
    int depth = 0;
    for (int i = 0; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (c == open) {
        depth++;
      } else if (c == close) {
        depth--;
        if (depth < 0) return new ValidationError(id, "unmatched closing " + singular + " at index " + i);
      }
    }
    if (depth > 0) return new ValidationError(id, "missing " + depth + " closing " + (depth == 1 ? singular : plural));
    return null;
  }
}
