package campus.jdbc.outbox;

import campus.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.util.List;

/**
 * PostgreSQL outbox store. Creates counter rows with {@code ON CONFLICT DO NOTHING} and
 * increments them with {@code UPDATE ... RETURNING} in one round trip.
 */
public final class PostgresOutboxStore extends AbstractJdbcOutboxStore {

  public PostgresOutboxStore() {
    super();
  }

  public PostgresOutboxStore(String tableName, String streamTableName) {
    super(tableName, streamTableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public PostgresOutboxStore withTableNames(String tableName, String streamTableName) {
    return new PostgresOutboxStore(tableName, streamTableName);
  }

  @Override
  protected void ensureStream(Connection conn, String streamName) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + streamTableName() + " (stream_name, last_offset) VALUES (?, 0)"
            + " ON CONFLICT (stream_name) DO NOTHING",
        streamName);
  }

  @Override
  protected long reserveOffsets(Connection conn, String streamName, int count) {
    return JdbcTemplate.queryOne(conn,
            "UPDATE " + streamTableName() + " SET last_offset = last_offset + ?"
                + " WHERE stream_name = ? RETURNING last_offset",
            rs -> rs.getLong(1), count, streamName)
        .orElseThrow(() -> new IllegalStateException("Missing counter row for stream " + streamName));
  }
}
