package campus.event;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link EventRecorder}, owned by value by every aggregate.
 */
public final class Recorder implements EventRecorder {
  private final List<DomainEvent> uncommitted = new ArrayList<>();

  @Override
  public void addEvent(DomainEvent event) {
    uncommitted.add(Objects.requireNonNull(event, "event"));
  }

  @Override
  public List<DomainEvent> getUncommittedEvents() {
    return List.copyOf(uncommitted);
  }

  @Override
  public void clearEvents() {
    uncommitted.clear();
  }

  public boolean hasUncommittedEvents() {
    return !uncommitted.isEmpty();
  }
}
