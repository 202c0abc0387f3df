package campus.user;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

public record StaffRegistered(
    EventHeader header,
    TracingCarrier tracing,
    Identifier staffId,
    String barcode,
    String username,
    Identifier registrationId,
    String email,
    String firstName,
    String lastName
) implements DomainEvent {

  @Override
  public String streamName() {
    return Staff.EVENT_STREAM;
  }
}
