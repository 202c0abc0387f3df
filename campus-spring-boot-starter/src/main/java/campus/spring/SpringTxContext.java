package campus.spring;

import campus.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} over Spring-managed transactions.
 *
 * <p>The connection is the one {@link DataSourceUtils} has bound to the current Spring
 * transaction, so outbox rows are written together with the repository's statements.
 * Commit and rollback callbacks become {@link TransactionSynchronization}s.
 */
public final class SpringTxContext implements TxContext {
  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  @Override
  public Connection currentConnection() {
    requireActive();
    return DataSourceUtils.getConnection(dataSource);
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    register("afterCommit", new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        callback.run();
      }
    });
  }

  @Override
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    register("afterRollback", new TransactionSynchronization() {
      @Override
      public void afterCompletion(int status) {
        if (status == STATUS_ROLLED_BACK) {
          callback.run();
        }
      }
    });
  }

  private void register(String phase, TransactionSynchronization synchronization) {
    requireActive();
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot register " + phase + " callback");
    }
    TransactionSynchronizationManager.registerSynchronization(synchronization);
  }

  private void requireActive() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
  }
}
