package campus.spring;

import campus.app.CampusEvents;
import campus.error.AlreadyExistsException;
import campus.event.JacksonEventCodec;
import campus.jdbc.JdbcSchema;
import campus.jdbc.JdbcTemplate;
import campus.jdbc.outbox.H2OutboxStore;
import campus.jdbc.repository.JdbcRegistrationRepository;
import campus.outbox.OutboxPublisher;
import campus.registration.Registration;
import campus.registration.RegistrationPolicy;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class SpringTransactionsTest {
  private JdbcDataSource dataSource;
  private SpringTxContext txContext;
  private SpringTransactions transactions;
  private TransactionTemplate outer;
  private JdbcRegistrationRepository repository;
  private final Clock clock = Clock.systemUTC();

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:campus_spring_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    JdbcSchema.initialize(dataSource);

    DataSourceTransactionManager txManager = new DataSourceTransactionManager(dataSource);
    txContext = new SpringTxContext(dataSource);
    transactions = new SpringTransactions(dataSource, txManager);
    outer = new TransactionTemplate(txManager);
    OutboxPublisher publisher = new OutboxPublisher(
        txContext, new H2OutboxStore(), new JacksonEventCodec(CampusEvents.registry()));
    repository = new JdbcRegistrationRepository(transactions, txContext, publisher, RegistrationPolicy.DEFAULT, clock);
  }

  @Test
  void repositoryCommitsRowAndOutboxRecord() throws SQLException {
    Registration registration = Registration.start("ada@example.com", RegistrationPolicy.DEFAULT, clock);

    repository.save(registration);

    assertEquals(1, count("registration"));
    assertEquals(1, count("outbox_message"));
    assertTrue(registration.events().getUncommittedEvents().isEmpty());
  }

  @Test
  void repositoryJoinsOuterTransaction() throws SQLException {
    Registration registration = Registration.start("ada@example.com", RegistrationPolicy.DEFAULT, clock);

    outer.executeWithoutResult(status -> {
      repository.save(registration);
      status.setRollbackOnly();
    });

    assertEquals(0, count("registration"));
    assertEquals(0, count("outbox_message"));
    assertEquals(1, registration.events().getUncommittedEvents().size());
  }

  @Test
  void callbacksFollowOutcome() {
    List<String> calls = new ArrayList<>();

    transactions.inTransaction(conn -> {
      assertTrue(txContext.isTransactionActive());
      assertSame(conn, txContext.currentConnection());
      txContext.afterCommit(() -> calls.add("commit"));
      txContext.afterRollback(() -> calls.add("not rolled back"));
      return null;
    });
    assertThrows(IllegalStateException.class, () -> transactions.inTransaction(conn -> {
      txContext.afterCommit(() -> calls.add("not committed"));
      txContext.afterRollback(() -> calls.add("rollback"));
      throw new IllegalStateException("boom");
    }));

    assertEquals(List.of("commit", "rollback"), calls);
  }

  @Test
  void uniqueViolationIsTranslated() {
    repository.save(Registration.start("ada@example.com", RegistrationPolicy.DEFAULT, clock));

    assertThrows(AlreadyExistsException.class,
        () -> repository.save(Registration.start("ada@example.com", RegistrationPolicy.DEFAULT, clock)));
  }

  @Test
  void interruptRollsBack() throws SQLException {
    try {
      assertThrows(CancellationException.class, () -> transactions.inTransaction(conn -> {
        JdbcTemplate.update(conn, "INSERT INTO outbox_stream (stream_name, last_offset) VALUES ('events_x', 0)");
        Thread.currentThread().interrupt();
        return null;
      }));
    } finally {
      Thread.interrupted();
    }

    assertEquals(0, count("outbox_stream"));
  }

  @Test
  void contextOutsideTransaction() {
    assertFalse(txContext.isTransactionActive());
    assertThrows(IllegalStateException.class, () -> txContext.currentConnection());
    assertThrows(IllegalStateException.class, () -> txContext.afterCommit(() -> { }));
  }

  private int count(String table) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      return JdbcTemplate.queryOne(conn, "SELECT COUNT(*) FROM " + table, rs -> rs.getInt(1)).orElse(0);
    }
  }
}
