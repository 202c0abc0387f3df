package campus.invitation;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

public record StaffInvitationDeleted(
    EventHeader header,
    TracingCarrier tracing,
    Identifier invitationId
) implements DomainEvent {

  @Override
  public String streamName() {
    return StaffInvitation.EVENT_STREAM;
  }
}
