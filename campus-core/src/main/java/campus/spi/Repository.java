package campus.spi;

import campus.Aggregate;
import campus.Identifier;

import java.util.Optional;

/**
 * Persists aggregates together with the events they recorded.
 *
 * <p>Both write operations store the aggregate row and publish its uncommitted events to
 * the outbox in one transaction, then clear the aggregate's recorder after the commit.
 * If the transaction rolls back, neither the state nor any event becomes durable.
 *
 * @param <T> aggregate type
 */
public interface Repository<T extends Aggregate> {

  /**
   * Inserts a new aggregate.
   *
   * @throws campus.error.AlreadyExistsException if a unique key is taken
   */
  void save(T aggregate);

  /**
   * Loads the aggregate with a row lock, applies {@code mutation} and persists the result.
   *
   * <p>If the mutation throws a {@linkplain campus.error.DomainException#persistable()
   * persistable} error, the state and events are still committed and the error is
   * rethrown afterwards. Any other exception rolls the transaction back.
   *
   * @throws campus.error.NotFoundException       if no aggregate has {@code id}
   * @throws campus.error.NoRowsAffectedException if the row vanished before the update
   * @throws NullPointerException                 if {@code mutation} is null
   */
  void update(Identifier id, Mutation<T> mutation);

  Optional<T> findById(Identifier id);
}
