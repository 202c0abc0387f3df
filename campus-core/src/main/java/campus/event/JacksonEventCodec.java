package campus.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * {@link EventCodec} writing event records as JSON with Jackson.
 *
 * <p>Timestamps are ISO-8601 strings. Unknown JSON properties are ignored so that a
 * consumer can read events produced by a newer version that added fields.
 */
public final class JacksonEventCodec implements EventCodec {
  private final EventTypeRegistry registry;
  private final ObjectMapper mapper;

  public JacksonEventCodec(EventTypeRegistry registry) {
    this(registry, defaultMapper());
  }

  public JacksonEventCodec(EventTypeRegistry registry, ObjectMapper mapper) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /** Mapper configured the way this codec expects; shared with row mappers. */
  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  public String typeName(DomainEvent event) {
    return registry.nameOf(event);
  }

  @Override
  public String encode(DomainEvent event) {
    registry.require(event.getClass());
    try {
      return mapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new EventCodecException("Failed to serialize event " + event.header().id(), e);
    }
  }

  @Override
  public DomainEvent decode(String typeName, String payload) {
    EventTypeRegistry.EventType<?> type = registry.find(typeName)
        .orElseThrow(() -> new UnknownEventTypeException(typeName));
    try {
      return mapper.readValue(payload, type.eventClass());
    } catch (JsonProcessingException e) {
      throw new EventCodecException("Failed to deserialize " + typeName, e);
    }
  }

  public EventTypeRegistry registry() {
    return registry;
  }
}
