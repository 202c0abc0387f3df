package campus.jdbc;

import campus.MutableClock;
import campus.app.RegistrationService;
import campus.error.AlreadyExistsException;
import campus.error.TooSoonException;
import campus.jdbc.repository.JdbcRegistrationRepository;
import campus.jdbc.repository.JdbcUserRepository;
import campus.model.OutboxRecord;
import campus.registration.Registration;
import campus.registration.RegistrationPolicy;
import campus.spi.PasswordHasher;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private static final int THREADS = 8;

  private HikariDataSource hikariDs;
  private TestDatabase db;
  private RegistrationService registrations;

  @BeforeEach
  void setUp() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    config.setMaximumPoolSize(THREADS);
    config.setMinimumIdle(1);
    config.setPoolName("campus-test-pool");
    hikariDs = new HikariDataSource(config);

    MutableClock clock = MutableClock.at("2024-09-01T08:00:00Z");
    db = new TestDatabase(hikariDs, clock);
    PasswordHasher hasher = new PasswordHasher() {
      @Override
      public String hash(String plaintext) {
        return plaintext;
      }

      @Override
      public boolean matches(String hash, String plaintext) {
        return hash.equals(plaintext);
      }
    };
    registrations = new RegistrationService(
        new JdbcRegistrationRepository(db.transactions, db.txContext, db.publisher, RegistrationPolicy.DEFAULT, clock),
        new JdbcUserRepository(db.transactions, db.txContext, db.publisher, clock),
        hasher,
        RegistrationPolicy.DEFAULT,
        clock);
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void concurrentStartsCreateOneRegistration() throws Exception {
    CountDownLatch ready = new CountDownLatch(THREADS);
    CountDownLatch go = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    List<Future<?>> futures = new ArrayList<>();
    Callable<Object> start = () -> {
      ready.countDown();
      go.await();
      return registrations.start("ada@example.com");
    };
    for (int i = 0; i < THREADS; i++) {
      futures.add(executor.submit(start));
    }
    assertTrue(ready.await(5, TimeUnit.SECONDS));
    go.countDown();

    int succeeded = 0;
    for (Future<?> future : futures) {
      try {
        future.get(10, TimeUnit.SECONDS);
        succeeded++;
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        assertTrue(cause instanceof AlreadyExistsException || cause instanceof TooSoonException,
            "unexpected " + cause);
      }
    }
    executor.shutdown();

    assertEquals(1, succeeded);
    assertEquals(1, db.count("SELECT COUNT(*) FROM registration"));
    List<OutboxRecord> records = db.records(Registration.EVENT_STREAM);
    assertEquals(1, records.size());
    assertEquals("RegistrationStarted", records.get(0).eventType());
  }

  @Test
  void concurrentAppendsGetDistinctOffsets() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    List<Future<Object>> futures = new ArrayList<>();
    for (int i = 0; i < THREADS * 4; i++) {
      String email = "user" + i + "@example.com";
      futures.add(executor.submit(() -> registrations.start(email)));
    }
    for (Future<Object> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }
    executor.shutdown();

    List<OutboxRecord> records = db.records(Registration.EVENT_STREAM);
    assertEquals(THREADS * 4, records.size());
    for (int i = 0; i < records.size(); i++) {
      assertEquals(i + 1L, records.get(i).offset());
    }
  }
}
