package campus.jdbc.outbox;

import campus.jdbc.TestDatabase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOutboxStoresTest {

  @Test
  void allContainsRegisteredStores() {
    assertEquals(2, JdbcOutboxStores.all().size());
  }

  @Test
  void getByNameIsCaseInsensitive() {
    assertInstanceOf(H2OutboxStore.class, JdbcOutboxStores.get("H2"));
    assertInstanceOf(PostgresOutboxStore.class, JdbcOutboxStores.get("postgresql"));
  }

  @Test
  void getUnknownThrows() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.get("oracle"));
    assertTrue(e.getMessage().contains("oracle"));
  }

  @Test
  void detectFromUrl() {
    assertEquals("h2", JdbcOutboxStores.detect("jdbc:h2:mem:test").name());
    assertEquals("postgresql", JdbcOutboxStores.detect("jdbc:postgresql://localhost:5432/campus").name());
  }

  @Test
  void detectRejectsUnsupportedUrl() {
    assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.detect("jdbc:mysql://localhost/campus"));
    assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.detect(""));
  }

  @Test
  void detectFromDataSourceWithCustomTables() {
    AbstractJdbcOutboxStore store = JdbcOutboxStores.detect(TestDatabase.h2(), "my_outbox", "my_streams");

    assertInstanceOf(H2OutboxStore.class, store);
    assertEquals("my_outbox", store.tableName());
    assertEquals("my_streams", store.streamTableName());
  }
}
