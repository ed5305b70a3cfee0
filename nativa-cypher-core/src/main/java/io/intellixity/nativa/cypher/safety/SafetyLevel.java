package io.intellixity.nativa.cypher.safety;

public enum SafetyLevel {
  /** No checks. */
  OFF,
  /** Log a warning per suspicious literal. */
  WARN,
  /** Reject suspicious literals. */
  STRICT
}
