package io.intellixity.nativa.cypher.validation;

import io.intellixity.nativa.cypher.CypherException;

import java.util.List;
import java.util.stream.Collectors;

/** Raised by {@link CypherValidator#requireValid}; carries every violation found. */
public final class CypherValidationException extends CypherException {
  private final List<ValidationError> errors;

  public CypherValidationException(List<ValidationError> errors) {
    super(Kind.VALIDATION, "Validator", describe(errors));
    this.errors = List.copyOf(errors);
  }

  public List<ValidationError> errors() { return errors; }

  private static String describe(List<ValidationError> errors) {
    return errors.stream().map(ValidationError::toString).collect(Collectors.joining("; "));
  }
}
