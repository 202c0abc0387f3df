package campus.registration;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

/** Emitted when the verification code was confirmed. */
public record RegistrationVerified(
    EventHeader header,
    TracingCarrier tracing,
    Identifier registrationId,
    String email
) implements DomainEvent {

  @Override
  public String streamName() {
    return Registration.EVENT_STREAM;
  }
}
