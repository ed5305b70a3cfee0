package io.intellixity.nativa.cypher;

/** Raised by a factory given an invalid argument (absent reference, empty required list, blank name). */
public final class CypherConstructionException extends CypherException {
  public CypherConstructionException(String component, String message) {
    super(Kind.CONSTRUCTION, component, message);
  }

  public static <T> T requirePresent(T value, String component, String what) {
    if (value == null) throw new CypherConstructionException(component, what + " must not be null");
    return value;
  }

  public static String requireText(String value, String component, String what) {
    if (value == null || value.isBlank()) throw new CypherConstructionException(component, what + " must not be blank");
    return value;
  }
}
