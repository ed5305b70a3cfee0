package io.intellixity.nativa.cypher.validation;

/**
 * Heuristic check over Cypher text.
 * <p>
 * Implementations registered in {@code META-INF/nativa-cypher.factories} under this interface's name are
 * picked up by {@link CypherValidator#defaults()} and {@link CypherValidator#strict()}; they need a public
 * no-arg constructor.
 */
public interface ValidationRule {
  String id();

  String description();

  /** Lowest validator level at which this rule runs. */
  ValidationLevel level();

  /**
   * @param cypher statement text
   * @param masked the same text with the contents of string literals and backtick identifiers blanked out;
   *               same length, so indexes line up
   * @return the violation, or null when the text passes
   */
  ValidationError check(String cypher, String masked);
}
