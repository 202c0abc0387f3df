package campus.jdbc;

import campus.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Auto-commit connections from a {@link DataSource}, normally a pool. The event processor
 * uses them as is; {@link campus.jdbc.tx.JdbcTransactionManager} switches auto-commit off.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    Connection conn = dataSource.getConnection();
    try {
      if (!conn.getAutoCommit()) {
        conn.setAutoCommit(true);
      }
      return conn;
    } catch (SQLException e) {
      try {
        conn.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }
}
