package campus.event;

/**
 * Thrown when a stored type identifier has no registered event class, typically because
 * the consumer is older than the producer's event catalog.
 */
public final class UnknownEventTypeException extends RuntimeException {
  private final String typeName;

  public UnknownEventTypeException(String typeName) {
    super("Unknown event type: " + typeName);
    this.typeName = typeName;
  }

  public String typeName() {
    return typeName;
  }
}
