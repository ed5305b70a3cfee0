package io.intellixity.nativa.cypher.validation;

/** How much checking a {@link CypherValidator} does; each level includes the ones before it. */
public enum ValidationLevel {
  OFF,
  /** Delimiter balance. */
  BASIC,
  /** Style heuristics on top of BASIC. */
  STRICT;

  public boolean includes(ValidationLevel other) {
    return this != OFF && other != null && other != OFF && other.ordinal() <= ordinal();
  }
}
