package campus.jdbc.repository;

import campus.jdbc.JdbcTemplate;
import campus.user.Role;
import campus.user.User;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Mapping of the {@code app_user} table, shared by the user, student and staff
 * repositories.
 */
final class UserRows {
  static final String COLUMNS = "u.id, u.barcode, u.username, u.email, u.first_name, u.last_name,"
      + " u.avatar_url, u.user_role, u.password_hash, u.created_at, u.updated_at";

  private UserRows() {}

  static User.Snapshot snapshot(ResultSet rs) throws SQLException {
    return new User.Snapshot(
        JdbcTemplate.getIdentifier(rs, "id"),
        rs.getString("barcode"),
        rs.getString("username"),
        rs.getString("email"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("avatar_url"),
        Role.fromValue(rs.getString("user_role")),
        rs.getString("password_hash"),
        JdbcTemplate.getInstant(rs, "created_at"),
        JdbcTemplate.getInstant(rs, "updated_at"));
  }

  static void insert(Connection conn, User.Snapshot s) {
    JdbcTemplate.update(conn,
        "INSERT INTO app_user (id, barcode, username, email, first_name, last_name, avatar_url,"
            + " user_role, password_hash, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?,?)",
        s.id(), s.barcode(), s.username(), s.email(), s.firstName(), s.lastName(), s.avatarUrl(),
        s.role().value(), s.passwordHash(), s.createdAt(), s.updatedAt());
  }

  static int update(Connection conn, User.Snapshot s) {
    return JdbcTemplate.update(conn,
        "UPDATE app_user SET first_name = ?, last_name = ?, avatar_url = ?, user_role = ?,"
            + " updated_at = ? WHERE id = ?",
        s.firstName(), s.lastName(), s.avatarUrl(), s.role().value(), s.updatedAt(), s.id());
  }
}
