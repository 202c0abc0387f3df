package campus.processor;

/**
 * Thrown by a handler that cannot interpret an event and wants it acknowledged instead of
 * retried. The event is counted as skipped.
 */
public class UnknownEventException extends RuntimeException {
  public UnknownEventException(String message) {
    super(message);
  }
}
