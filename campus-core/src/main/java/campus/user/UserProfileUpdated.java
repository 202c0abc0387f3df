package campus.user;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

/** Emitted when a user's names change. */
public record UserProfileUpdated(
    EventHeader header,
    TracingCarrier tracing,
    Identifier userId,
    String firstName,
    String lastName
) implements DomainEvent {

  @Override
  public String streamName() {
    return User.EVENT_STREAM;
  }
}
