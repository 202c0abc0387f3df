package campus.user;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

public record StudentRegistered(
    EventHeader header,
    TracingCarrier tracing,
    Identifier studentId,
    String barcode,
    String username,
    Identifier registrationId,
    String email,
    String firstName,
    String lastName,
    Identifier groupId,
    Major major,
    String year
) implements DomainEvent {

  @Override
  public String streamName() {
    return Student.EVENT_STREAM;
  }
}
