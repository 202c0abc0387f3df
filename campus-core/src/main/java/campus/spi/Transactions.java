package campus.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs work in a database transaction. Joins the transaction already bound to the
 * current thread, otherwise begins one, commits on normal return and rolls back when the
 * callback throws.
 *
 * <p>Implementations must roll back instead of committing when the calling thread was
 * interrupted, and report it as {@link java.util.concurrent.CancellationException}.
 */
public interface Transactions {

  @FunctionalInterface
  interface TxCallback<T> {
    T doInTransaction(Connection connection) throws SQLException;
  }

  /**
   * @throws PersistenceException on JDBC failures
   */
  <T> T inTransaction(TxCallback<T> callback);
}
