package campus.validation;

import java.util.Objects;

/**
 * One rejected field.
 *
 * @param field   path of the field, e.g. {@code recipients[2]}
 * @param message human-readable reason
 */
public record FieldError(String field, String message) {
  public FieldError {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(message, "message");
  }
}
