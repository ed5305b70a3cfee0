package io.intellixity.nativa.cypher.validation;

import java.util.Objects;

/** One rule violation. */
public record ValidationError(String rule, String message) {
  public ValidationError {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(message, "message");
  }

  @Override
  public String toString() { return rule + ": " + message; }
}
