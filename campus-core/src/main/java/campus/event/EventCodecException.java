package campus.event;

/**
 * Thrown when an event cannot be serialized or deserialized.
 */
public class EventCodecException extends RuntimeException {
  public EventCodecException(String message, Throwable cause) {
    super(message, cause);
  }
}
