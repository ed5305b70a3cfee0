package io.intellixity.nativa.cypher;

/**
 * Raised when a clause cannot render its own text during {@code build()}.
 * <p>
 * A predecessor's failure is never wrapped in this type: it propagates exactly as thrown.
 */
public final class CypherBuildException extends CypherException {
  public CypherBuildException(String component, String message) {
    super(Kind.BUILD, component, message);
  }

  public CypherBuildException(String component, String message, Throwable cause) {
    super(Kind.BUILD, component, message, cause);
  }
}
