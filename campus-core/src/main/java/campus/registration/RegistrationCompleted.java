package campus.registration;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;
import campus.user.Major;
import campus.user.Role;

/**
 * Emitted when a verified registration is completed with a profile. Carries what is
 * needed to create the user; {@code major}, {@code groupId} and {@code year} are set for
 * students only.
 */
public record RegistrationCompleted(
    EventHeader header,
    TracingCarrier tracing,
    Identifier registrationId,
    Role role,
    String email,
    String barcode,
    String firstName,
    String lastName,
    String passwordHash,
    Major major,
    Identifier groupId,
    String year
) implements DomainEvent {

  @Override
  public String streamName() {
    return Registration.EVENT_STREAM;
  }
}
