package campus.invitation;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

import java.time.Instant;

/** Emitted when the validity window changes. Either bound may be null (open). */
public record ValidityUpdated(
    EventHeader header,
    TracingCarrier tracing,
    Identifier invitationId,
    Instant validFrom,
    Instant validUntil
) implements DomainEvent {

  @Override
  public String streamName() {
    return StaffInvitation.EVENT_STREAM;
  }
}
