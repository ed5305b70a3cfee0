package io.intellixity.nativa.cypher;

/** Raised at {@code STRICT} safety level when a string literal carries characters that belong in a parameter. */
public final class UnsafeLiteralException extends CypherException {
  public UnsafeLiteralException(String message) {
    super(Kind.SAFETY, "Literal", message);
  }
}
