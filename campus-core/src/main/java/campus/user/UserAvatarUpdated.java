package campus.user;

import campus.Identifier;
import campus.event.DomainEvent;
import campus.event.EventHeader;
import campus.event.TracingCarrier;

/** Emitted when an avatar is set, replaced or removed ({@code avatarUrl} null). */
public record UserAvatarUpdated(
    EventHeader header,
    TracingCarrier tracing,
    Identifier userId,
    String avatarUrl
) implements DomainEvent {

  @Override
  public String streamName() {
    return User.EVENT_STREAM;
  }
}
