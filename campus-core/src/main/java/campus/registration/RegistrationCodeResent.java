package campus.registration;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

/** Emitted when a new verification code replaces the previous one. */
public record RegistrationCodeResent(
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
