package campus.validation;

/**
 * Explicit validator for one input type. Implementations report into the supplied
 * {@link FieldErrors}; callers decide when to throw.
 */
@FunctionalInterface
public interface Validator<T> {

  void validate(T value, FieldErrors errors);

  /**
   * Validates {@code value} and throws if anything was rejected.
   *
   * @throws campus.error.ValidationException with every rejected field
   */
  default void check(T value) {
    FieldErrors errors = new FieldErrors();
    validate(value, errors);
    errors.throwIfAny();
  }
}
