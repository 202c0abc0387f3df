package campus.error;

/** The aggregate's current state does not allow the requested transition. */
public final class InvalidStateException extends DomainException {
  public InvalidStateException(String message) {
    super("invalid_state", message);
  }
}
