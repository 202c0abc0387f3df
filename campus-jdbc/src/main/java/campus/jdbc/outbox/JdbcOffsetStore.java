package campus.jdbc.outbox;

import campus.jdbc.DuplicateKeyException;
import campus.jdbc.JdbcTemplate;
import campus.jdbc.TableNames;
import campus.spi.OffsetStore;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * {@link OffsetStore} over the consumer offset table. Portable across H2 and PostgreSQL.
 *
 * <p>{@link #subscribe} is meant for auto-commit connections: it inserts the row and
 * treats a unique violation as "already subscribed".
 */
public final class JdbcOffsetStore implements OffsetStore {
  private static final Logger logger = Logger.getLogger(JdbcOffsetStore.class.getName());

  private final String tableName;
  private final Clock clock;

  public JdbcOffsetStore() {
    this(TableNames.CONSUMER_OFFSET, Clock.systemUTC());
  }

  public JdbcOffsetStore(String tableName, Clock clock) {
    this.tableName = TableNames.validate(tableName);
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public long subscribe(Connection conn, String streamName, String consumerGroup) {
    if (!exists(conn, streamName, consumerGroup)) {
      try {
        JdbcTemplate.update(conn,
            "INSERT INTO " + tableName
                + " (stream_name, consumer_group, last_offset, updated_at) VALUES (?, ?, 0, ?)",
            streamName, consumerGroup, Instant.now(clock));
        logger.fine("Created offset for " + streamName + "/" + consumerGroup);
      } catch (DuplicateKeyException e) {
        logger.fine("Offset for " + streamName + "/" + consumerGroup + " created concurrently");
      }
    }
    return currentOffset(conn, streamName, consumerGroup);
  }

  private boolean exists(Connection conn, String streamName, String consumerGroup) {
    return JdbcTemplate.queryOne(conn,
        "SELECT 1 FROM " + tableName + " WHERE stream_name = ? AND consumer_group = ?",
        rs -> Boolean.TRUE, streamName, consumerGroup).isPresent();
  }

  @Override
  public long currentOffset(Connection conn, String streamName, String consumerGroup) {
    return JdbcTemplate.queryOne(conn,
            "SELECT last_offset FROM " + tableName + " WHERE stream_name = ? AND consumer_group = ?",
            rs -> rs.getLong(1), streamName, consumerGroup)
        .orElse(0L);
  }

  @Override
  public boolean advance(Connection conn, String streamName, String consumerGroup, long expected, long next) {
    if (next < expected) {
      throw new IllegalArgumentException("Offset cannot move backwards: " + expected + " -> " + next);
    }
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET last_offset = ?, updated_at = ?"
            + " WHERE stream_name = ? AND consumer_group = ? AND last_offset = ?",
        next, Instant.now(clock), streamName, consumerGroup, expected);
    return updated == 1;
  }

  @Override
  public Set<String> consumedBy(Connection conn, String streamName, long offset) {
    return new LinkedHashSet<>(JdbcTemplate.query(conn,
        "SELECT consumer_group FROM " + tableName
            + " WHERE stream_name = ? AND last_offset >= ? ORDER BY consumer_group",
        rs -> rs.getString(1), streamName, offset));
  }

  public String tableName() {
    return tableName;
  }
}
