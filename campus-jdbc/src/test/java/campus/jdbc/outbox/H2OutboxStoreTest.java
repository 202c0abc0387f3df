package campus.jdbc.outbox;

import campus.Identifier;
import campus.jdbc.DuplicateKeyException;
import campus.jdbc.JdbcSchema;
import campus.jdbc.TestDatabase;
import campus.model.OutboxMessage;
import campus.model.OutboxRecord;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class H2OutboxStoreTest {

  private static final Instant NOW = Instant.parse("2024-09-01T08:00:00Z");

  private JdbcDataSource dataSource;
  private H2OutboxStore store;

  @BeforeEach
  void setUp() {
    dataSource = TestDatabase.h2();
    JdbcSchema.initialize(dataSource);
    store = new H2OutboxStore();
  }

  @Test
  void offsetsStartAtOneAndArePerStream() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      List<OutboxRecord> first = store.append(conn, "events_a", List.of(message("A1"), message("A2")));
      List<OutboxRecord> other = store.append(conn, "events_b", List.of(message("B1")));
      List<OutboxRecord> second = store.append(conn, "events_a", List.of(message("A3")));

      assertEquals(List.of(1L, 2L), List.of(first.get(0).offset(), first.get(1).offset()));
      assertEquals(1L, other.get(0).offset());
      assertEquals(3L, second.get(0).offset());
      assertEquals(3L, store.latestOffset(conn, "events_a"));
      assertEquals(1L, store.latestOffset(conn, "events_b"));
    }
  }

  @Test
  void readAfterReturnsAscendingPage() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      store.append(conn, "events_a", List.of(message("A1"), message("A2"), message("A3"), message("A4")));

      List<OutboxRecord> page = store.readAfter(conn, "events_a", 1, 2);

      assertEquals(2, page.size());
      assertEquals(2L, page.get(0).offset());
      assertEquals("A2", page.get(0).eventType());
      assertEquals("{\"n\":\"A2\"}", page.get(0).payload());
      assertEquals(NOW, page.get(0).createdAt());
      assertEquals(3L, page.get(1).offset());
      assertTrue(store.readAfter(conn, "events_a", 4, 10).isEmpty());
    }
  }

  @Test
  void storedRecordKeepsEventId() throws SQLException {
    OutboxMessage message = message("A1");
    try (Connection conn = dataSource.getConnection()) {
      store.append(conn, "events_a", List.of(message));

      assertEquals(message.eventId(), store.readAfter(conn, "events_a", 0, 1).get(0).eventId());
    }
  }

  @Test
  void unknownStreamIsEmpty() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0L, store.latestOffset(conn, "events_none"));
      assertTrue(store.readAfter(conn, "events_none", 0, 10).isEmpty());
      assertTrue(store.append(conn, "events_none", List.of()).isEmpty());
    }
  }

  @Test
  void rollbackReleasesNoOffsets() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      store.append(conn, "events_a", List.of(message("A1")));
      conn.rollback();
      conn.setAutoCommit(true);

      assertEquals(1L, store.append(conn, "events_a", List.of(message("A2"))).get(0).offset());
    }
  }

  @Test
  void duplicateEventIdIsRejected() throws SQLException {
    OutboxMessage message = message("A1");
    try (Connection conn = dataSource.getConnection()) {
      store.append(conn, "events_a", List.of(message));

      assertThrows(DuplicateKeyException.class, () -> store.append(conn, "events_b", List.of(message)));
    }
  }

  @Test
  void customTableNames() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute(
          "CREATE TABLE custom_stream (stream_name VARCHAR(128) PRIMARY KEY, last_offset BIGINT NOT NULL)");
      conn.createStatement().execute(
          "CREATE TABLE custom_message (stream_name VARCHAR(128) NOT NULL, stream_offset BIGINT NOT NULL,"
              + " event_id UUID NOT NULL UNIQUE, event_type VARCHAR(128) NOT NULL,"
              + " payload CHARACTER VARYING NOT NULL, created_at TIMESTAMP WITH TIME ZONE NOT NULL,"
              + " PRIMARY KEY (stream_name, stream_offset))");
      H2OutboxStore custom = store.withTableNames("custom_message", "custom_stream");

      custom.append(conn, "events_a", List.of(message("A1")));

      assertEquals("custom_message", custom.tableName());
      assertEquals(1L, custom.latestOffset(conn, "events_a"));
      assertEquals(0L, store.latestOffset(conn, "events_a"));
    }
  }

  @Test
  void rejectsInvalidTableName() {
    assertThrows(IllegalArgumentException.class, () -> new H2OutboxStore("outbox; DROP TABLE x", "outbox_stream"));
  }

  private static OutboxMessage message(String type) {
    return new OutboxMessage(Identifier.newId(), type, "{\"n\":\"" + type + "\"}", NOW);
  }
}
