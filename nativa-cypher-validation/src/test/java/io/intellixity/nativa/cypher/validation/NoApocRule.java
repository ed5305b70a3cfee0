package io.intellixity.nativa.cypher.validation;

/** Registered through META-INF/nativa-cypher.factories in test resources. */
public final class NoApocRule implements ValidationRule {
  public NoApocRule() {}

  @Override public String id() { return "NO_APOC"; }
  @Override public String description() { return "APOC procedures are not installed"; }
  @Override public ValidationLevel level() { return ValidationLevel.BASIC; }

  @Override
  public ValidationError check(String cypher, String masked) {
    return masked.contains("apoc.") ? new ValidationError(id(), "APOC call found") : null;
  }
}
