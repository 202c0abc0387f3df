package campus.jdbc;

import campus.spi.PersistenceException;

import java.sql.SQLException;

/**
 * Unchecked wrapper for a failed JDBC call.
 */
public class JdbcAccessException extends PersistenceException {
  public JdbcAccessException(String message, SQLException cause) {
    super(message, cause);
  }

  /** SQLState of the underlying exception, or null. */
  public String sqlState() {
    return getCause() instanceof SQLException sql ? sql.getSQLState() : null;
  }
}
