package campus.app;

import campus.Identifier;
import campus.MutableClock;
import campus.event.EventHeader;
import campus.event.TracingCarrier;
import campus.processor.UnknownEventException;
import campus.registration.RegistrationCompleted;
import campus.user.Major;
import campus.user.Role;
import campus.user.Staff;
import campus.user.StaffRegistered;
import campus.user.Student;
import campus.user.StudentRegistered;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegistrationCompletedHandlerTest {

  private MutableClock clock;
  private InMemoryRepository.Users users;
  private InMemoryRepository.Students students;
  private InMemoryRepository.Staffs staff;
  private RegistrationCompletedHandler handler;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-09-01T08:00:00Z");
    users = new InMemoryRepository.Users(clock);
    students = new InMemoryRepository.Students(users, clock);
    staff = new InMemoryRepository.Staffs(users, clock);
    handler = new RegistrationCompletedHandler(users, students, staff, clock);
  }

  @Test
  void createsStudent() {
    RegistrationCompleted event = completed(Role.STUDENT, "ada@example.com");

    handler.handle(event);

    Student student = students.rows.values().iterator().next();
    assertEquals("A1234567", student.user().barcode());
    assertEquals("$argon2id$hash", student.user().passwordHash());
    StudentRegistered registered = assertInstanceOf(StudentRegistered.class, students.published.get(0));
    assertEquals(event.registrationId(), registered.registrationId());
    assertTrue(users.existsByEmail("ada@example.com"));
  }

  @Test
  void createsStaff() {
    handler.handle(completed(Role.STAFF, "grace@example.com"));

    Staff created = staff.rows.values().iterator().next();
    assertEquals(Role.STAFF, created.user().role());
    assertInstanceOf(StaffRegistered.class, staff.published.get(0));
  }

  @Test
  void redeliveryIsIdempotent() {
    RegistrationCompleted event = completed(Role.STUDENT, "ada@example.com");

    handler.handle(event);
    handler.handle(event);

    assertEquals(1, students.rows.size());
    assertEquals(1, students.published.size());
  }

  @Test
  void unsupportedRoleIsAcknowledged() {
    assertThrows(UnknownEventException.class, () -> handler.handle(completed(Role.GUEST, "ada@example.com")));
    assertTrue(users.rows.isEmpty());
  }

  @Test
  void takenBarcodeIsAcknowledgedWithoutAccount() {
    handler.handle(completed(Role.STAFF, "grace@example.com"));

    assertThrows(UnknownEventException.class, () -> handler.handle(completed(Role.STUDENT, "ada@example.com")));

    assertFalse(users.existsByEmail("ada@example.com"));
    assertTrue(students.rows.isEmpty());
  }

  @Test
  void subscribesUnderProjectorGroup() {
    assertEquals(RegistrationCompletedHandler.GROUP, handler.name());
    assertEquals(RegistrationCompleted.class, handler.eventType());
  }

  private RegistrationCompleted completed(Role role, String email) {
    boolean student = role == Role.STUDENT;
    return new RegistrationCompleted(
        EventHeader.create(clock.instant()),
        TracingCarrier.empty(),
        Identifier.newId(),
        role,
        email,
        "A1234567",
        "Ada",
        "Lovelace",
        "$argon2id$hash",
        student ? Major.COMPUTER_SCIENCE : null,
        student ? Identifier.newId() : null,
        student ? "2024" : null);
  }
}
