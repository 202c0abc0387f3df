package campus.registration;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

/** Emitted when a registration expires after too many failed attempts. */
public record RegistrationFailed(
    EventHeader header,
    TracingCarrier tracing,
    Identifier registrationId,
    String reason
) implements DomainEvent {

  @Override
  public String streamName() {
    return Registration.EVENT_STREAM;
  }
}
