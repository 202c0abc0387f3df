package campus.error;

/** The submitted verification code does not match. */
public final class InvalidCodeException extends DomainException {
  public InvalidCodeException(boolean persistable) {
    super("invalid_code", "verification code mismatch", persistable);
  }
}
