package campus.event;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of known event types: type identifier to record class and stream name.
 *
 * <p>The type identifier is the record's simple class name. It is written to every
 * outbox row and used by consumers to pick the decoder and handler, so an event class
 * must not be renamed once it has been published.
 */
public final class EventTypeRegistry {
  private final Map<String, EventType<?>> byName = new ConcurrentHashMap<>();
  private final Map<Class<?>, EventType<?>> byClass = new ConcurrentHashMap<>();

  /**
   * A registered event type.
   *
   * @param name       type identifier stored with each outbox row
   * @param eventClass concrete record class
   * @param streamName outbox stream the type is published to
   */
  public record EventType<E extends DomainEvent>(String name, Class<E> eventClass, String streamName) {
    public EventType {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(eventClass, "eventClass");
      Objects.requireNonNull(streamName, "streamName");
    }
  }

  /**
   * Registers {@code eventClass} on {@code streamName}.
   *
   * @return this registry for chaining
   * @throws IllegalStateException if the type name is already registered to another class
   */
  public <E extends DomainEvent> EventTypeRegistry register(Class<E> eventClass, String streamName) {
    EventType<E> type = new EventType<>(eventClass.getSimpleName(), eventClass, streamName);
    EventType<?> existing = byName.putIfAbsent(type.name(), type);
    if (existing != null && !existing.equals(type)) {
      throw new IllegalStateException("Event type " + type.name() + " already registered as "
          + existing.eventClass().getName() + " on " + existing.streamName());
    }
    byClass.put(eventClass, type);
    return this;
  }

  public Optional<EventType<?>> find(String name) {
    return Optional.ofNullable(byName.get(name));
  }

  /**
   * @throws IllegalArgumentException if {@code eventClass} was never registered
   */
  @SuppressWarnings("unchecked")
  public <E extends DomainEvent> EventType<E> require(Class<E> eventClass) {
    EventType<?> type = byClass.get(eventClass);
    if (type == null) {
      throw new IllegalArgumentException("Unregistered event type: " + eventClass.getName());
    }
    return (EventType<E>) type;
  }

  public String nameOf(DomainEvent event) {
    return require(event.getClass()).name();
  }

  public Collection<EventType<?>> all() {
    return List.copyOf(byName.values());
  }
}
