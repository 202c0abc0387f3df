package campus.event;

/**
 * Immutable fact describing a completed state transition.
 *
 * <p>Implementations are records carrying a snapshot of the fields relevant to the
 * transition, never the whole aggregate. The stream name selects the outbox stream the
 * event is appended to; the type identifier is resolved through {@link EventTypeRegistry}.
 */
public interface DomainEvent {

  EventHeader header();

  TracingCarrier tracing();

  String streamName();
}
