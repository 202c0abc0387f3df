package campus.event;

import java.util.List;

/**
 * Buffer of events recorded by an aggregate during one use-case call.
 *
 * <p>Aggregate methods only {@linkplain #addEvent append}. {@link #clearEvents()} belongs
 * to repositories and runs after the transaction that persisted the events commits, so an
 * event is never released before it is durable.
 */
public interface EventRecorder {

  void addEvent(DomainEvent event);

  /** Returns an unmodifiable snapshot in recording order. */
  List<DomainEvent> getUncommittedEvents();

  void clearEvents();
}
