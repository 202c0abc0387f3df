package campus.jdbc;

import java.sql.SQLException;

/**
 * SQLState classification shared by stores and repositories.
 */
public final class SqlStates {
  static final String UNIQUE_VIOLATION = "23505";
  static final String INTEGRITY_CONSTRAINT_VIOLATION = "23000";

  private SqlStates() {}

  /**
   * True if {@code e}, or an exception chained to it, reports a unique key violation.
   * H2 and PostgreSQL use {@code 23505}; some drivers only report the class {@code 23000}.
   */
  public static boolean isUniqueViolation(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      String state = current.getSQLState();
      if (UNIQUE_VIOLATION.equals(state) || INTEGRITY_CONSTRAINT_VIOLATION.equals(state)) {
        return true;
      }
    }
    return false;
  }

  /** Wraps {@code e} in {@link DuplicateKeyException} or {@link JdbcAccessException}. */
  public static JdbcAccessException translate(String message, SQLException e) {
    if (isUniqueViolation(e)) {
      return new DuplicateKeyException(message, e);
    }
    return new JdbcAccessException(message, e);
  }
}
