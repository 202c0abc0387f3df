package campus.jdbc.outbox;

import campus.jdbc.JdbcTemplate;
import campus.jdbc.TableNames;
import campus.model.OutboxMessage;
import campus.model.OutboxRecord;
import campus.spi.OutboxStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base JDBC outbox store.
 *
 * <p>Records live in the message table keyed by (stream, offset). Each stream has a
 * counter row in the stream table holding its last assigned offset. {@link #append}
 * creates the counter row if needed, then increments it; the row lock taken by the
 * increment is held until the caller's transaction ends, which serializes appenders of
 * one stream and makes records visible in offset order.
 *
 * <p>Subclasses provide the dialect-specific counter creation and may override the
 * increment. Register custom implementations via
 * {@code META-INF/services/campus.jdbc.outbox.AbstractJdbcOutboxStore}.
 *
 * @see JdbcOutboxStores
 */
public abstract class AbstractJdbcOutboxStore implements OutboxStore {

  protected static final JdbcTemplate.RowMapper<OutboxRecord> RECORD_ROW_MAPPER = rs -> new OutboxRecord(
      rs.getString("stream_name"),
      rs.getLong("stream_offset"),
      JdbcTemplate.getIdentifier(rs, "event_id"),
      rs.getString("event_type"),
      rs.getString("payload"),
      JdbcTemplate.getInstant(rs, "created_at"));

  private final String tableName;
  private final String streamTableName;

  protected AbstractJdbcOutboxStore() {
    this(TableNames.OUTBOX_MESSAGE, TableNames.OUTBOX_STREAM);
  }

  protected AbstractJdbcOutboxStore(String tableName, String streamTableName) {
    this.tableName = TableNames.validate(tableName);
    this.streamTableName = TableNames.validate(streamTableName);
  }

  /**
   * Unique identifier for this outbox store (e.g., "postgresql", "h2"). Also selects the
   * schema script, see {@link campus.jdbc.JdbcSchema}.
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this outbox store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /** Returns a store of the same dialect using the given tables. */
  public abstract AbstractJdbcOutboxStore withTableNames(String tableName, String streamTableName);

  /**
   * Inserts the counter row of {@code streamName} with offset 0 unless it exists, without
   * failing when a concurrent transaction inserts it first.
   */
  protected abstract void ensureStream(Connection conn, String streamName);

  /**
   * Adds {@code count} to the counter of {@code streamName}, locking its row until the
   * transaction ends.
   *
   * @return the counter value after the increment
   */
  protected long reserveOffsets(Connection conn, String streamName, int count) {
    int updated = JdbcTemplate.update(conn,
        "UPDATE " + streamTableName + " SET last_offset = last_offset + ? WHERE stream_name = ?",
        count, streamName);
    if (updated != 1) {
      throw new IllegalStateException("Missing counter row for stream " + streamName);
    }
    return latestOffset(conn, streamName);
  }

  public String tableName() {
    return tableName;
  }

  public String streamTableName() {
    return streamTableName;
  }

  @Override
  public List<OutboxRecord> append(Connection conn, String streamName, List<OutboxMessage> messages) {
    Objects.requireNonNull(streamName, "streamName");
    if (messages.isEmpty()) {
      return List.of();
    }
    ensureStream(conn, streamName);
    long last = reserveOffsets(conn, streamName, messages.size());
    long offset = last - messages.size();

    List<OutboxRecord> records = new ArrayList<>(messages.size());
    List<Object[]> rows = new ArrayList<>(messages.size());
    for (OutboxMessage message : messages) {
      offset++;
      records.add(new OutboxRecord(streamName, offset, message.eventId(), message.eventType(),
          message.payload(), message.createdAt()));
      rows.add(new Object[] {
          streamName, offset, message.eventId(), message.eventType(), message.payload(), message.createdAt()});
    }
    JdbcTemplate.batchUpdate(conn,
        "INSERT INTO " + tableName
            + " (stream_name, stream_offset, event_id, event_type, payload, created_at) VALUES (?,?,?,?,?,?)",
        rows);
    return records;
  }

  @Override
  public List<OutboxRecord> readAfter(Connection conn, String streamName, long afterOffset, int limit) {
    String sql = "SELECT stream_name, stream_offset, event_id, event_type, payload, created_at"
        + " FROM " + tableName
        + " WHERE stream_name = ? AND stream_offset > ?"
        + " ORDER BY stream_offset LIMIT ?";
    return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, streamName, afterOffset, limit);
  }

  @Override
  public long latestOffset(Connection conn, String streamName) {
    return JdbcTemplate.queryOne(conn,
            "SELECT last_offset FROM " + streamTableName + " WHERE stream_name = ?",
            rs -> rs.getLong(1), streamName)
        .orElse(0L);
  }
}
