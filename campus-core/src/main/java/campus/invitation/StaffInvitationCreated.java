package campus.invitation;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

import java.time.Instant;
import java.util.List;

/** Emitted when a staff invitation is created; every recipient should be invited. */
public record StaffInvitationCreated(
    EventHeader header,
    TracingCarrier tracing,
    Identifier invitationId,
    String code,
    List<String> recipients,
    Instant validFrom,
    Instant validUntil,
    Identifier creatorId
) implements DomainEvent {

  public StaffInvitationCreated {
    recipients = List.copyOf(recipients);
  }

  @Override
  public String streamName() {
    return StaffInvitation.EVENT_STREAM;
  }
}
