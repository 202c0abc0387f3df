package campus.error;

import campus.validation.FieldError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Malformed input. Carries the first offending error of each field path.
 */
public final class ValidationException extends DomainException {
  private final List<FieldError> errors;

  public ValidationException(List<FieldError> errors) {
    super("validation_failed", describe(errors));
    if (errors.isEmpty()) {
      throw new IllegalArgumentException("errors must not be empty");
    }
    this.errors = List.copyOf(errors);
  }

  public static ValidationException of(String field, String message) {
    return new ValidationException(List.of(new FieldError(field, message)));
  }

  public List<FieldError> errors() {
    return errors;
  }

  /** True if any error was reported for {@code field}. */
  public boolean hasErrorFor(String field) {
    return errors.stream().anyMatch(e -> e.field().equals(field));
  }

  private static String describe(List<FieldError> errors) {
    return "validation failed: " + errors.stream()
        .map(e -> e.field() + ": " + e.message())
        .collect(Collectors.joining("; "));
  }
}
