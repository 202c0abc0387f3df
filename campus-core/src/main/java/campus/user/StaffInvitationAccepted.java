package campus.user;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

/**
 * A staff account created by accepting a staff invitation.
 */
public record StaffInvitationAccepted(
    EventHeader header,
    TracingCarrier tracing,
    Identifier staffId,
    String barcode,
    String username,
    Identifier invitationId,
    String email,
    String firstName,
    String lastName
) implements DomainEvent {

  @Override
  public String streamName() {
    return Staff.EVENT_STREAM;
  }
}
