package campus.validation;

import campus.Identifier;
import campus.error.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects field errors, keeping only the first one per field path.
 *
 * <pre>{@code
 * new FieldErrors()
 *     .requireLength("firstName", firstName, 2, 100)
 *     .requireEmail("email", email)
 *     .throwIfAny();
 * }</pre>
 */
public final class FieldErrors {
  private final Map<String, FieldError> errors = new LinkedHashMap<>();

  public FieldErrors reject(String field, String message) {
    errors.putIfAbsent(field, new FieldError(field, message));
    return this;
  }

  public FieldErrors requireNonNull(String field, Object value) {
    if (value == null) {
      reject(field, "is required");
    }
    return this;
  }

  public FieldErrors requireId(String field, Identifier value) {
    if (Identifier.isMissing(value)) {
      reject(field, "is required");
    }
    return this;
  }

  public FieldErrors requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      reject(field, "is required");
    }
    return this;
  }

  /** Requires a non-blank value whose length is within {@code [min, max]}. */
  public FieldErrors requireLength(String field, String value, int min, int max) {
    if (value == null || value.isBlank()) {
      return reject(field, "is required");
    }
    return optionalLength(field, value, min, max);
  }

  /** Like {@link #requireLength} but accepts {@code null}. */
  public FieldErrors optionalLength(String field, String value, int min, int max) {
    if (value != null && (value.length() < min || value.length() > max)) {
      reject(field, "the length must be between " + min + " and " + max);
    }
    return this;
  }

  public FieldErrors requireEmail(String field, String value) {
    if (value == null || value.isEmpty()) {
      return reject(field, "is required");
    }
    if (value.length() > Emails.MAX_LENGTH) {
      return reject(field, "the length must be no more than " + Emails.MAX_LENGTH);
    }
    if (!Emails.isWellFormed(value)) {
      reject(field, "must be a valid email address");
    }
    return this;
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public boolean hasErrorFor(String field) {
    return errors.containsKey(field);
  }

  public List<FieldError> toList() {
    return new ArrayList<>(errors.values());
  }

  /**
   * @throws ValidationException if any field was rejected
   */
  public void throwIfAny() {
    if (!errors.isEmpty()) {
      throw new ValidationException(toList());
    }
  }
}
