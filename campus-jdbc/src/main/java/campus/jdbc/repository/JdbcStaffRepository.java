package campus.jdbc.repository;

import campus.Identifier;
import campus.jdbc.JdbcTemplate;
import campus.outbox.OutboxPublisher;
import campus.spi.Transactions;
import campus.spi.TxContext;
import campus.user.Role;
import campus.user.Staff;
import campus.user.StaffRepository;

import java.sql.Connection;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Staff members are {@code app_user} rows with the staff role.
 */
public final class JdbcStaffRepository extends AbstractJdbcRepository<Staff> implements StaffRepository {
  private static final String SELECT = "SELECT " + UserRows.COLUMNS + " FROM app_user u WHERE u.id = ? AND u.user_role = '"
      + Role.STAFF.value() + "'";

  private final JdbcTemplate.RowMapper<Staff> mapper;

  public JdbcStaffRepository(Transactions transactions, TxContext txContext, OutboxPublisher publisher, Clock clock) {
    super(transactions, txContext, publisher, "staff");
    Objects.requireNonNull(clock, "clock");
    this.mapper = rs -> Staff.rehydrate(UserRows.snapshot(rs), clock);
  }

  @Override
  protected void insert(Connection conn, Staff staff) {
    UserRows.insert(conn, staff.user().snapshot());
  }

  @Override
  protected Optional<Staff> selectForUpdate(Connection conn, Identifier id) {
    return JdbcTemplate.queryOne(conn, SELECT + " FOR UPDATE", mapper, id);
  }

  @Override
  protected Optional<Staff> select(Connection conn, Identifier id) {
    return JdbcTemplate.queryOne(conn, SELECT, mapper, id);
  }

  @Override
  protected int updateRow(Connection conn, Staff staff) {
    return UserRows.update(conn, staff.user().snapshot());
  }
}
