package campus.jdbc.repository;

import campus.Identifier;
import campus.jdbc.JdbcTemplate;
import campus.outbox.OutboxPublisher;
import campus.spi.Transactions;
import campus.spi.TxContext;
import campus.user.User;
import campus.user.UserRepository;

import java.sql.Connection;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Users of any role. New accounts are created through {@link JdbcStudentRepository} or
 * {@link JdbcStaffRepository}; {@link #save} inserts a bare user row.
 */
public final class JdbcUserRepository extends AbstractJdbcRepository<User> implements UserRepository {
  private static final String SELECT = "SELECT " + UserRows.COLUMNS + " FROM app_user u";

  private final JdbcTemplate.RowMapper<User> mapper;

  public JdbcUserRepository(Transactions transactions, TxContext txContext, OutboxPublisher publisher, Clock clock) {
    super(transactions, txContext, publisher, "user");
    Objects.requireNonNull(clock, "clock");
    this.mapper = rs -> User.rehydrate(UserRows.snapshot(rs), clock);
  }

  @Override
  protected void insert(Connection conn, User user) {
    UserRows.insert(conn, user.snapshot());
  }

  @Override
  protected Optional<User> selectForUpdate(Connection conn, Identifier id) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE u.id = ? FOR UPDATE", mapper, id);
  }

  @Override
  protected Optional<User> select(Connection conn, Identifier id) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE u.id = ?", mapper, id);
  }

  @Override
  protected int updateRow(Connection conn, User user) {
    return UserRows.update(conn, user.snapshot());
  }

  @Override
  public Optional<User> findByEmail(String email) {
    return inTransaction(conn -> JdbcTemplate.queryOne(conn, SELECT + " WHERE u.email = ?", mapper, email));
  }

  @Override
  public boolean existsByEmail(String email) {
    return inTransaction(conn -> JdbcTemplate.queryOne(conn,
        "SELECT 1 FROM app_user WHERE email = ?", rs -> Boolean.TRUE, email).isPresent());
  }

  @Override
  public boolean existsByBarcode(String barcode) {
    return inTransaction(conn -> JdbcTemplate.queryOne(conn,
        "SELECT 1 FROM app_user WHERE barcode = ?", rs -> Boolean.TRUE, barcode).isPresent());
  }
}
