package campus.spring;

import campus.jdbc.SqlStates;
import campus.spi.Transactions;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * {@link Transactions} backed by a Spring {@link TransactionTemplate}, so repositories join
 * {@code @Transactional} methods of the application.
 *
 * <p>A transaction whose thread was interrupted is rolled back instead of committed.
 */
public final class SpringTransactions implements Transactions {
  private final DataSource dataSource;
  private final TransactionTemplate template;

  public SpringTransactions(DataSource dataSource, PlatformTransactionManager transactionManager) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.template = new TransactionTemplate(Objects.requireNonNull(transactionManager, "transactionManager"));
  }

  @Override
  public <T> T inTransaction(TxCallback<T> callback) {
    Objects.requireNonNull(callback, "callback");
    return template.execute(status -> {
      T result;
      try {
        result = callback.doInTransaction(DataSourceUtils.getConnection(dataSource));
      } catch (SQLException e) {
        throw SqlStates.translate("Transaction failed", e);
      }
      if (Thread.currentThread().isInterrupted()) {
        status.setRollbackOnly();
        throw new CancellationException("Transaction cancelled by interrupt");
      }
      return result;
    });
  }
}
