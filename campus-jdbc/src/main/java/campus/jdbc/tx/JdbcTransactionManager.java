package campus.jdbc.tx;

import campus.jdbc.SqlStates;
import campus.spi.ConnectionProvider;
import campus.spi.Transactions;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transactions} for plain JDBC. Obtains a connection, disables auto-commit and
 * binds it to a {@link ThreadLocalTxContext} for the duration of the callback.
 *
 * <pre>{@code
 * ThreadLocalTxContext txContext = new ThreadLocalTxContext();
 * JdbcTransactionManager tx = new JdbcTransactionManager(connections, txContext);
 * tx.inTransaction(conn -> {
 *   ...
 *   return null;
 * });
 * }</pre>
 *
 * <p>Nested calls join the outer transaction. If the thread was interrupted by the time
 * the callback returns, the transaction is rolled back and {@link CancellationException}
 * is thrown; the interrupt flag stays set.
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager implements Transactions {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  @Override
  public <T> T inTransaction(TxCallback<T> callback) {
    Objects.requireNonNull(callback, "callback");
    if (txContext.isTransactionActive()) {
      try {
        return callback.doInTransaction(txContext.currentConnection());
      } catch (SQLException e) {
        throw SqlStates.translate("Transaction callback failed", e);
      }
    }

    Connection connection = open();
    boolean committed = false;
    try {
      T result = callback.doInTransaction(connection);
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("Transaction cancelled: thread interrupted before commit");
      }
      connection.commit();
      committed = true;
      return result;
    } catch (SQLException e) {
      throw SqlStates.translate(committed ? "Commit failed" : "Transaction failed", e);
    } finally {
      if (!committed) {
        rollbackQuietly(connection);
      }
      List<Runnable> callbacks = txContext.unbind(committed);
      release(connection);
      ThreadLocalTxContext.runAll(callbacks, committed ? "afterCommit" : "afterRollback");
    }
  }

  private Connection open() {
    Connection connection;
    try {
      connection = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw SqlStates.translate("Failed to obtain connection", e);
    }
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      release(connection);
      throw SqlStates.translate("Failed to begin transaction", e);
    }
    txContext.bind(connection);
    return connection;
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  private static void rollbackQuietly(Connection connection) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback failed", e);
    }
  }

  private static void release(Connection connection) {
    try {
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to restore auto-commit", e);
    }
    try {
      connection.close();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Failed to close connection", e);
    }
  }
}
