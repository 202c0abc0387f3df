package campus.error;

/**
 * Opaque wrapper for unexpected failures leaving a service. The cause is kept for logs,
 * the message is not meant for end users.
 */
public final class InternalException extends DomainException {
  public InternalException(String operation, Throwable cause) {
    super("internal", operation + " failed", cause);
  }
}
