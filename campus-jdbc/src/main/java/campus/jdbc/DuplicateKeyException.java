package campus.jdbc;

import java.sql.SQLException;

/**
 * A statement violated a unique or primary key constraint. Repositories translate it to
 * {@link campus.error.AlreadyExistsException}.
 */
public class DuplicateKeyException extends JdbcAccessException {
  public DuplicateKeyException(String message, SQLException cause) {
    super(message, cause);
  }
}
