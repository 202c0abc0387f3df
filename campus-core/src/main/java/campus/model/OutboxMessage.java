package campus.model;

import campus.Identifier;

import java.time.Instant;
import java.util.Objects;

/**
 * An encoded event waiting to be appended to a stream.
 *
 * @param eventId   id from the event header
 * @param eventType type identifier used to decode the payload
 * @param payload   encoded event
 * @param createdAt event timestamp
 */
public record OutboxMessage(Identifier eventId, String eventType, String payload, Instant createdAt) {
  public OutboxMessage {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
