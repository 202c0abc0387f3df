package campus.processor;

import campus.event.DomainEvent;

/**
 * Consumer of one event type.
 *
 * <p>A handler registered on its own forms a consumer group named {@link #name()} on the
 * stream of {@link #eventType()}; grouped handlers share the group of their
 * {@link HandlerGroup}. Delivery is at-least-once, so handlers must be idempotent.
 *
 * @param <E> handled event type
 */
public interface EventHandler<E extends DomainEvent> {

  /** Consumer group name when registered individually. */
  String name();

  Class<E> eventType();

  /**
   * Handles one event. Throwing leaves the event unacknowledged and it is delivered again
   * after a backoff, except for {@link UnknownEventException}, which acknowledges it.
   */
  void handle(E event) throws Exception;

  static <E extends DomainEvent> EventHandler<E> of(String name, Class<E> eventType, Consumer<E> consumer) {
    return new EventHandler<>() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Class<E> eventType() {
        return eventType;
      }

      @Override
      public void handle(E event) throws Exception {
        consumer.accept(event);
      }

      @Override
      public String toString() {
        return "EventHandler[" + name + ", " + eventType.getSimpleName() + "]";
      }
    };
  }

  /** Handler body for {@link #of}. */
  @FunctionalInterface
  interface Consumer<E> {
    void accept(E event) throws Exception;
  }
}
