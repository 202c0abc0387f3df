package campus.spi;

import java.sql.Connection;

/**
 * View of the transaction bound to the current thread.
 *
 * <p>The outbox publisher writes through {@link #currentConnection()} so events share the
 * transaction of the state change that produced them. Callbacks registered with
 * {@link #afterCommit} run only once that transaction is durable.
 */
public interface TxContext {

  boolean isTransactionActive();

  /**
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  void afterCommit(Runnable callback);

  void afterRollback(Runnable callback);
}
