package campus.processor;

import campus.event.EventTypeRegistry;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Thread-safe registry of event handlers, keyed by subscription and then by event type
 * name.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry handlers = new HandlerRegistry(events)
 *     .register(new RegistrationCompletedHandler(...))
 *     .register(HandlerGroup.of("registration-mailer", started, resent));
 * }</pre>
 *
 * <p>The subscription stream is the stream of the handled event types. Within one
 * subscription each event type has at most one handler.
 */
public final class HandlerRegistry {
  private final EventTypeRegistry eventTypes;
  private final Map<Subscription, Map<String, EventHandler<?>>> handlers = new ConcurrentSkipListMap<>();

  public HandlerRegistry(EventTypeRegistry eventTypes) {
    this.eventTypes = Objects.requireNonNull(eventTypes, "eventTypes");
  }

  /**
   * Registers {@code handler} in its own consumer group {@link EventHandler#name()}.
   *
   * @return this registry for chaining
   * @throws IllegalArgumentException if the event type is not registered
   * @throws IllegalStateException    if the group already handles the event type
   */
  public HandlerRegistry register(EventHandler<?> handler) {
    Objects.requireNonNull(handler, "handler");
    EventTypeRegistry.EventType<?> type = eventTypes.require(handler.eventType());
    add(new Subscription(type.streamName(), handler.name()), type.name(), handler);
    return this;
  }

  /**
   * Registers every handler of {@code group} in one consumer group.
   *
   * @return this registry for chaining
   * @throws IllegalArgumentException if the handlers read different streams
   * @throws IllegalStateException    if two handlers share an event type
   */
  public HandlerRegistry register(HandlerGroup group) {
    Objects.requireNonNull(group, "group");
    String stream = null;
    for (EventHandler<?> handler : group.handlers()) {
      String handlerStream = eventTypes.require(handler.eventType()).streamName();
      if (stream == null) {
        stream = handlerStream;
      } else if (!stream.equals(handlerStream)) {
        throw new IllegalArgumentException("HandlerGroup " + group.name() + " spans streams "
            + stream + " and " + handlerStream);
      }
    }
    Subscription subscription = new Subscription(stream, group.name());
    for (EventHandler<?> handler : group.handlers()) {
      add(subscription, eventTypes.require(handler.eventType()).name(), handler);
    }
    return this;
  }

  private void add(Subscription subscription, String typeName, EventHandler<?> handler) {
    Map<String, EventHandler<?>> byType =
        handlers.computeIfAbsent(subscription, s -> new ConcurrentHashMap<>());
    EventHandler<?> existing = byType.putIfAbsent(typeName, handler);
    if (existing != null) {
      throw new IllegalStateException("Consumer group " + subscription.consumerGroup()
          + " already handles " + typeName + " with " + existing);
    }
  }

  /** Registered subscriptions in stream, then group order. */
  public List<Subscription> subscriptions() {
    return List.copyOf(handlers.keySet());
  }

  public Optional<EventHandler<?>> handlerFor(Subscription subscription, String typeName) {
    return Optional.ofNullable(handlers.getOrDefault(subscription, Map.of()).get(typeName));
  }

  /** Handlers of {@code subscription} keyed by event type name. */
  public Map<String, EventHandler<?>> handlersOf(Subscription subscription) {
    return Collections.unmodifiableMap(handlers.getOrDefault(subscription, Map.of()));
  }

  public EventTypeRegistry eventTypes() {
    return eventTypes;
  }
}
