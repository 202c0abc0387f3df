package campus.model;

import campus.Identifier;

import java.time.Instant;

/**
 * An event stored in the outbox.
 *
 * @param streamName stream the record belongs to
 * @param offset     position within the stream, starting at 1
 * @param eventId    id from the event header, usable for consumer-side deduplication
 * @param eventType  type identifier used to decode the payload
 * @param payload    encoded event
 * @param createdAt  event timestamp
 */
public record OutboxRecord(
    String streamName,
    long offset,
    Identifier eventId,
    String eventType,
    String payload,
    Instant createdAt
) {
}
