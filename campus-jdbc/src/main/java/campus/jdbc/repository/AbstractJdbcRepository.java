package campus.jdbc.repository;

import campus.Aggregate;
import campus.Identifier;
import campus.error.AlreadyExistsException;
import campus.error.DomainException;
import campus.error.NoRowsAffectedException;
import campus.error.NotFoundException;
import campus.event.DomainEvent;
import campus.jdbc.DuplicateKeyException;
import campus.outbox.OutboxPublisher;
import campus.spi.Mutation;
import campus.spi.Repository;
import campus.spi.Transactions;
import campus.spi.TxContext;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Template for JDBC repositories: subclasses map rows, this class runs the transaction and
 * publishes the aggregate's events through the outbox within it.
 *
 * <p>Events are cleared from the aggregate only after the commit. When the transaction
 * rolls back they stay recorded, and neither the row nor any outbox record is written.
 *
 * @param <T> aggregate type
 */
public abstract class AbstractJdbcRepository<T extends Aggregate> implements Repository<T> {
  private final Transactions transactions;
  private final TxContext txContext;
  private final OutboxPublisher publisher;
  private final String resource;

  /**
   * @param resource name used in error messages, e.g. "registration"
   */
  protected AbstractJdbcRepository(
      Transactions transactions, TxContext txContext, OutboxPublisher publisher, String resource) {
    this.transactions = Objects.requireNonNull(transactions, "transactions");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.resource = Objects.requireNonNull(resource, "resource");
  }

  protected abstract void insert(Connection conn, T aggregate);

  /** Loads the aggregate and locks its row(s) until the transaction ends. */
  protected abstract Optional<T> selectForUpdate(Connection conn, Identifier id);

  protected abstract Optional<T> select(Connection conn, Identifier id);

  /** @return rows affected in the aggregate's main table */
  protected abstract int updateRow(Connection conn, T aggregate);

  @Override
  public void save(T aggregate) {
    Objects.requireNonNull(aggregate, "aggregate");
    transactions.inTransaction(conn -> {
      try {
        insert(conn, aggregate);
      } catch (DuplicateKeyException e) {
        throw new AlreadyExistsException(resource + " already exists", e);
      }
      flush(aggregate);
      return null;
    });
  }

  @Override
  public void update(Identifier id, Mutation<T> mutation) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(mutation, "mutation");
    DomainException rejected = transactions.inTransaction(conn -> {
      T aggregate = selectForUpdate(conn, id).orElseThrow(() -> new NotFoundException(resource));

      DomainException persistable = null;
      try {
        mutation.apply(aggregate);
      } catch (DomainException e) {
        if (!e.persistable()) {
          throw e;
        }
        persistable = e;
      }

      int rows;
      try {
        rows = updateRow(conn, aggregate);
      } catch (DuplicateKeyException e) {
        throw new AlreadyExistsException(resource + " already exists", e);
      }
      if (rows == 0) {
        throw new NoRowsAffectedException(resource);
      }
      flush(aggregate);
      return persistable;
    });
    if (rejected != null) {
      throw rejected;
    }
  }

  @Override
  public Optional<T> findById(Identifier id) {
    Objects.requireNonNull(id, "id");
    return transactions.inTransaction(conn -> select(conn, id));
  }

  protected <R> R inTransaction(Transactions.TxCallback<R> callback) {
    return transactions.inTransaction(callback);
  }

  private void flush(T aggregate) {
    List<DomainEvent> events = aggregate.events().getUncommittedEvents();
    if (events.isEmpty()) {
      return;
    }
    publisher.publish(events);
    txContext.afterCommit(aggregate.events()::clearEvents);
  }
}
