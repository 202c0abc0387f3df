package campus.jdbc.repository;

import campus.Identifier;
import campus.jdbc.JdbcTemplate;
import campus.outbox.OutboxPublisher;
import campus.spi.Transactions;
import campus.spi.TxContext;
import campus.user.Major;
import campus.user.Student;
import campus.user.StudentRepository;

import java.sql.Connection;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Students span {@code app_user} and {@code student}; both rows are written in one
 * transaction.
 */
public final class JdbcStudentRepository extends AbstractJdbcRepository<Student> implements StudentRepository {
  private static final String SELECT = "SELECT " + UserRows.COLUMNS + ", s.major, s.group_id, s.study_year"
      + " FROM app_user u JOIN student s ON s.user_id = u.id";

  private final JdbcTemplate.RowMapper<Student> mapper;

  public JdbcStudentRepository(Transactions transactions, TxContext txContext, OutboxPublisher publisher, Clock clock) {
    super(transactions, txContext, publisher, "student");
    Objects.requireNonNull(clock, "clock");
    this.mapper = rs -> Student.rehydrate(new Student.Snapshot(
        UserRows.snapshot(rs),
        Major.valueOf(rs.getString("major")),
        JdbcTemplate.getIdentifier(rs, "group_id"),
        rs.getString("study_year")), clock);
  }

  @Override
  protected void insert(Connection conn, Student student) {
    Student.Snapshot s = student.snapshot();
    UserRows.insert(conn, s.user());
    JdbcTemplate.update(conn,
        "INSERT INTO student (user_id, major, group_id, study_year) VALUES (?,?,?,?)",
        s.user().id(), s.major().name(), s.groupId(), s.year());
  }

  @Override
  protected Optional<Student> selectForUpdate(Connection conn, Identifier id) {
    // the app_user row guards both tables
    boolean locked = JdbcTemplate.queryOne(conn,
        "SELECT id FROM app_user WHERE id = ? FOR UPDATE", rs -> Boolean.TRUE, id).isPresent();
    return locked ? select(conn, id) : Optional.empty();
  }

  @Override
  protected Optional<Student> select(Connection conn, Identifier id) {
    return JdbcTemplate.queryOne(conn, SELECT + " WHERE u.id = ?", mapper, id);
  }

  @Override
  protected int updateRow(Connection conn, Student student) {
    Student.Snapshot s = student.snapshot();
    int rows = UserRows.update(conn, s.user());
    JdbcTemplate.update(conn,
        "UPDATE student SET major = ?, group_id = ?, study_year = ? WHERE user_id = ?",
        s.major().name(), s.groupId(), s.year(), s.user().id());
    return rows;
  }
}
