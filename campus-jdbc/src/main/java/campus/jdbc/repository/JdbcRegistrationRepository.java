package campus.jdbc.repository;

import campus.Identifier;
import campus.jdbc.JdbcTemplate;
import campus.outbox.OutboxPublisher;
import campus.registration.Registration;
import campus.registration.RegistrationPolicy;
import campus.registration.RegistrationRepository;
import campus.registration.RegistrationStatus;
import campus.spi.Transactions;
import campus.spi.TxContext;

import java.sql.Connection;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

public final class JdbcRegistrationRepository extends AbstractJdbcRepository<Registration>
    implements RegistrationRepository {
  private static final String COLUMNS = "id, email, status, verification_code, code_attempts,"
      + " code_expires_at, resend_timeout, created_at, updated_at";

  private final RegistrationPolicy policy;
  private final Clock clock;
  private final JdbcTemplate.RowMapper<Registration> mapper;

  public JdbcRegistrationRepository(
      Transactions transactions,
      TxContext txContext,
      OutboxPublisher publisher,
      RegistrationPolicy policy,
      Clock clock) {
    super(transactions, txContext, publisher, "registration");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.mapper = rs -> Registration.rehydrate(new Registration.Snapshot(
        JdbcTemplate.getIdentifier(rs, "id"),
        rs.getString("email"),
        RegistrationStatus.fromValue(rs.getString("status")),
        rs.getString("verification_code"),
        rs.getInt("code_attempts"),
        JdbcTemplate.getInstant(rs, "code_expires_at"),
        JdbcTemplate.getInstant(rs, "resend_timeout"),
        JdbcTemplate.getInstant(rs, "created_at"),
        JdbcTemplate.getInstant(rs, "updated_at")), this.policy, this.clock);
  }

  @Override
  protected void insert(Connection conn, Registration registration) {
    Registration.Snapshot s = registration.snapshot();
    JdbcTemplate.update(conn,
        "INSERT INTO registration (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)",
        s.id(), s.email(), s.status().value(), s.verificationCode(), s.codeAttempts(),
        s.codeExpiresAt(), s.resendTimeout(), s.createdAt(), s.updatedAt());
  }

  @Override
  protected Optional<Registration> selectForUpdate(Connection conn, Identifier id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM registration WHERE id = ? FOR UPDATE", mapper, id);
  }

  @Override
  protected Optional<Registration> select(Connection conn, Identifier id) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM registration WHERE id = ?", mapper, id);
  }

  @Override
  protected int updateRow(Connection conn, Registration registration) {
    Registration.Snapshot s = registration.snapshot();
    return JdbcTemplate.update(conn,
        "UPDATE registration SET status = ?, verification_code = ?, code_attempts = ?,"
            + " code_expires_at = ?, resend_timeout = ?, updated_at = ? WHERE id = ?",
        s.status().value(), s.verificationCode(), s.codeAttempts(), s.codeExpiresAt(),
        s.resendTimeout(), s.updatedAt(), s.id());
  }

  @Override
  public Optional<Registration> findByEmail(String email) {
    return inTransaction(conn -> JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM registration WHERE email = ?", mapper, email));
  }
}
