package campus.event;

import campus.Identifier;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identity of a domain event: unique id, creation time and free-form metadata.
 *
 * @param id        unique per event, never reused
 * @param timestamp set when the event is created, never mutated
 * @param metadata  immutable key/value pairs (may be empty)
 */
public record EventHeader(Identifier id, Instant timestamp, Map<String, String> metadata) {

  public EventHeader {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(timestamp, "timestamp");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** Creates a header with a fresh id stamped at {@code timestamp}. */
  public static EventHeader create(Instant timestamp) {
    return new EventHeader(Identifier.newId(), timestamp, Map.of());
  }

  public EventHeader withMetadata(String key, String value) {
    Map<String, String> copy = new HashMap<>(metadata);
    copy.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return new EventHeader(id, timestamp, copy);
  }
}
