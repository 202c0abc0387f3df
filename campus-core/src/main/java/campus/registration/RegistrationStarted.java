package campus.registration;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

/** Emitted when a registration starts; the code is mailed to {@code email}. */
public record RegistrationStarted(
    EventHeader header,
    TracingCarrier tracing,
    Identifier registrationId,
    String email,
    String verificationCode
) implements DomainEvent {

  @Override
  public String streamName() {
    return Registration.EVENT_STREAM;
  }
}
