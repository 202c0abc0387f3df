package campus.error;

/**
 * The last allowed verification attempt failed; the registration expired and must be
 * restarted with a new code. Always persistable.
 */
public final class TooManyAttemptsException extends DomainException {
  public TooManyAttemptsException() {
    super("too_many_attempts", "too many failed verification attempts", true);
  }
}
