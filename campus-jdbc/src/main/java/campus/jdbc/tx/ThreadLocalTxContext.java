package campus.jdbc.tx;

import campus.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} storing the current transaction in a {@link ThreadLocal}.
 *
 * <p>Bound and released by {@link JdbcTransactionManager}; callbacks run after the
 * connection was committed or rolled back and released. A failing callback is logged and
 * does not prevent the others from running.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
  private static final Logger logger = Logger.getLogger(ThreadLocalTxContext.class.getName());

  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return require().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    require().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    require().afterRollback.add(callback);
  }

  private TxState require() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  /**
   * Unbinds the transaction of this thread.
   *
   * @return callbacks to run for the given outcome
   */
  List<Runnable> unbind(boolean committed) {
    TxState current = state.get();
    state.remove();
    if (current == null) {
      return List.of();
    }
    return committed ? current.afterCommit : current.afterRollback;
  }

  static void runAll(List<Runnable> callbacks, String phase) {
    for (Runnable callback : callbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, phase + " callback failed", e);
      }
    }
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
