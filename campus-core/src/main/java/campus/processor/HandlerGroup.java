package campus.processor;

import java.util.List;
import java.util.Objects;

/**
 * Handlers sharing one consumer group, and therefore one offset. All handlers must read
 * event types of the same stream.
 *
 * <pre>{@code
 * HandlerGroup mail = HandlerGroup.of("registration-mailer",
 *     new RegistrationStartedMailHandler(sender),
 *     new CodeResentMailHandler(sender));
 * }</pre>
 */
public final class HandlerGroup {
  private final String name;
  private final List<EventHandler<?>> handlers;

  public HandlerGroup(String name, List<? extends EventHandler<?>> handlers) {
    this.name = Objects.requireNonNull(name, "name");
    this.handlers = List.copyOf(handlers);
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    if (this.handlers.isEmpty()) {
      throw new IllegalArgumentException("HandlerGroup " + name + " has no handlers");
    }
  }

  public static HandlerGroup of(String name, EventHandler<?>... handlers) {
    return new HandlerGroup(name, List.of(handlers));
  }

  public String name() {
    return name;
  }

  public List<EventHandler<?>> handlers() {
    return handlers;
  }

  @Override
  public String toString() {
    return "HandlerGroup[" + name + ", " + handlers.size() + " handler(s)]";
  }
}
