package campus.error;

/** A unique key is already taken, either by earlier data or a concurrent writer. */
public final class AlreadyExistsException extends DomainException {
  public AlreadyExistsException(String message) {
    super("already_exists", message);
  }

  public AlreadyExistsException(String message, Throwable cause) {
    super("already_exists", message, cause);
  }
}
