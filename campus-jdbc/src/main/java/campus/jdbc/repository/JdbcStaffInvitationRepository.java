package campus.jdbc.repository;

import campus.Identifier;
import campus.invitation.StaffInvitation;
import campus.invitation.StaffInvitationRepository;
import campus.jdbc.JdbcTemplate;
import campus.outbox.OutboxPublisher;
import campus.spi.Transactions;
import campus.spi.TxContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores recipients as a JSON array in a text column.
 */
public final class JdbcStaffInvitationRepository extends AbstractJdbcRepository<StaffInvitation>
    implements StaffInvitationRepository {
  private static final String COLUMNS = "id, code, recipients, valid_from, valid_until, creator_id,"
      + " created_at, updated_at, deleted_at";
  private static final TypeReference<List<String>> RECIPIENTS = new TypeReference<>() {};

  private final ObjectMapper mapper;
  private final Clock clock;
  private final JdbcTemplate.RowMapper<StaffInvitation> rowMapper;

  public JdbcStaffInvitationRepository(
      Transactions transactions,
      TxContext txContext,
      OutboxPublisher publisher,
      ObjectMapper mapper,
      Clock clock) {
    super(transactions, txContext, publisher, "staff invitation");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.rowMapper = rs -> StaffInvitation.rehydrate(new StaffInvitation.Snapshot(
        JdbcTemplate.getIdentifier(rs, "id"),
        rs.getString("code"),
        readRecipients(rs.getString("recipients")),
        JdbcTemplate.getInstant(rs, "valid_from"),
        JdbcTemplate.getInstant(rs, "valid_until"),
        JdbcTemplate.getIdentifier(rs, "creator_id"),
        JdbcTemplate.getInstant(rs, "created_at"),
        JdbcTemplate.getInstant(rs, "updated_at"),
        JdbcTemplate.getInstant(rs, "deleted_at")), this.clock);
  }

  @Override
  protected void insert(Connection conn, StaffInvitation invitation) {
    StaffInvitation.Snapshot s = invitation.snapshot();
    JdbcTemplate.update(conn,
        "INSERT INTO staff_invitation (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)",
        s.id(), s.code(), writeRecipients(s.recipients()), s.validFrom(), s.validUntil(),
        s.creatorId(), s.createdAt(), s.updatedAt(), s.deletedAt());
  }

  @Override
  protected Optional<StaffInvitation> selectForUpdate(Connection conn, Identifier id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM staff_invitation WHERE id = ? FOR UPDATE", rowMapper, id);
  }

  @Override
  protected Optional<StaffInvitation> select(Connection conn, Identifier id) {
    return JdbcTemplate.queryOne(conn, "SELECT " + COLUMNS + " FROM staff_invitation WHERE id = ?", rowMapper, id);
  }

  @Override
  protected int updateRow(Connection conn, StaffInvitation invitation) {
    StaffInvitation.Snapshot s = invitation.snapshot();
    return JdbcTemplate.update(conn,
        "UPDATE staff_invitation SET recipients = ?, valid_from = ?, valid_until = ?,"
            + " updated_at = ?, deleted_at = ? WHERE id = ?",
        writeRecipients(s.recipients()), s.validFrom(), s.validUntil(), s.updatedAt(), s.deletedAt(), s.id());
  }

  @Override
  public Optional<StaffInvitation> findByCode(String code) {
    return inTransaction(conn -> JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM staff_invitation WHERE code = ?", rowMapper, code));
  }

  private String writeRecipients(List<String> recipients) {
    try {
      return mapper.writeValueAsString(recipients);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize recipients", e);
    }
  }

  private List<String> readRecipients(String json) throws SQLException {
    try {
      return mapper.readValue(json, RECIPIENTS);
    } catch (JsonProcessingException e) {
      throw new SQLException("Unreadable recipients column: " + e.getOriginalMessage(), e);
    }
  }
}
