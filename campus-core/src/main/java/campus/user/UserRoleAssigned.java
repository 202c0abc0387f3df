package campus.user;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

/** Emitted when a user's role changes. */
public record UserRoleAssigned(
    EventHeader header,
    TracingCarrier tracing,
    Identifier userId,
    Role previousRole,
    Role role
) implements DomainEvent {

  @Override
  public String streamName() {
    return User.EVENT_STREAM;
  }
}
