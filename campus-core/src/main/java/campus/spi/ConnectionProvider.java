package campus.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to code running outside a caller's transaction, such as the
 * event processor's pollers. Callers close the connection.
 */
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}
