package io.intellixity.nativa.cypher;

/**
 * Base type for every failure raised while constructing, building, validating or running Cypher.
 * <p>
 * Unchecked: a failure aborts the current construction or {@code build()} call and reaches the caller
 * unchanged. Independently held builder chains are unaffected.
 */
public class CypherException extends RuntimeException {
  public enum Kind { CONSTRUCTION, BUILD, VALIDATION, SAFETY, EXECUTION }

  private final Kind kind;
  private final String component;

  public CypherException(Kind kind, String component, String message) {
    super(message);
    this.kind = (kind == null) ? Kind.BUILD : kind;
    this.component = component;
  }

  public CypherException(Kind kind, String component, String message, Throwable cause) {
    super(message, cause);
    this.kind = (kind == null) ? Kind.BUILD : kind;
    this.component = component;
  }

  public Kind kind() { return kind; }

  /** Name of the factory, clause or collaborator that raised this failure (may be null). */
  public String component() { return component; }

  @Override
  public String getMessage() {
    String m = super.getMessage();
    return (component == null) ? m : component + ": " + m;
  }
}
