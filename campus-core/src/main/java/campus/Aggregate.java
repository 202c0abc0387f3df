package campus;

import campus.event.EventRecorder;

/**
 * Consistency boundary whose invariants are enforced by its own methods.
 *
 * <p>Aggregates are not thread-safe: a use case loads one instance, mutates it and
 * hands it to a repository. The events it records are exposed through {@link #events()};
 * only repositories clear them, after the owning transaction commits.
 */
public interface Aggregate {

  Identifier id();

  EventRecorder events();
}
