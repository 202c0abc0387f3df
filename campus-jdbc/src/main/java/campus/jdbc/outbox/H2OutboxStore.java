package campus.jdbc.outbox;

import campus.jdbc.JdbcTemplate;
import campus.jdbc.DuplicateKeyException;

import java.sql.Connection;
import java.util.List;
import java.util.logging.Logger;

/**
 * H2 outbox store. Primarily for tests and local runs.
 */
public final class H2OutboxStore extends AbstractJdbcOutboxStore {
  private static final Logger logger = Logger.getLogger(H2OutboxStore.class.getName());

  public H2OutboxStore() {
    super();
  }

  public H2OutboxStore(String tableName, String streamTableName) {
    super(tableName, streamTableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public H2OutboxStore withTableNames(String tableName, String streamTableName) {
    return new H2OutboxStore(tableName, streamTableName);
  }

  @Override
  protected void ensureStream(Connection conn, String streamName) {
    boolean exists = JdbcTemplate.queryOne(conn,
        "SELECT 1 FROM " + streamTableName() + " WHERE stream_name = ?", rs -> Boolean.TRUE, streamName)
        .isPresent();
    if (exists) {
      return;
    }
    try {
      JdbcTemplate.update(conn,
          "INSERT INTO " + streamTableName() + " (stream_name, last_offset) VALUES (?, 0)", streamName);
    } catch (DuplicateKeyException e) {
      // H2 rolls back only the failed statement
      logger.fine("Counter row of " + streamName + " created concurrently");
    }
  }
}
