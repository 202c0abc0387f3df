package campus.user;

import campus.Identifier;
import campus.MutableClock;
import campus.error.ValidationException;
import campus.event.DomainEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UserTest {

  private MutableClock clock;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2024-09-01T08:00:00Z");
  }

  @Test
  void studentRegistrationRecordsEventOnStudentStream() {
    Identifier groupId = Identifier.newId();
    Identifier registrationId = Identifier.newId();

    Student student = Student.register(details(), Major.CYBER_SECURITY, groupId, "2023", registrationId, clock);

    assertEquals(Role.STUDENT, student.user().role());
    assertEquals("A1234567", student.user().username());
    assertEquals(student.user().id(), student.id());
    StudentRegistered registered = assertInstanceOf(StudentRegistered.class, single(student.events().getUncommittedEvents()));
    assertEquals(Student.EVENT_STREAM, registered.streamName());
    assertEquals(registrationId, registered.registrationId());
    assertEquals(groupId, registered.groupId());
    assertEquals(Major.CYBER_SECURITY, registered.major());
  }

  @Test
  void studentRegistrationValidatesUserAndStudentFields() {
    User.Details bad = new User.Details("A1", "ada", "A", "Lovelace", "hash");

    ValidationException e = assertThrows(ValidationException.class,
        () -> Student.register(bad, null, null, "", null, clock));

    assertTrue(e.hasErrorFor("barcode"));
    assertTrue(e.hasErrorFor("email"));
    assertTrue(e.hasErrorFor("firstName"));
    assertTrue(e.hasErrorFor("major"));
    assertTrue(e.hasErrorFor("groupId"));
    assertTrue(e.hasErrorFor("year"));
  }

  @Test
  void staffRegistrationDefaultsMissingRegistrationId() {
    Staff staff = Staff.register(details(), null, clock);

    assertEquals(Role.STAFF, staff.user().role());
    StaffRegistered registered = assertInstanceOf(StaffRegistered.class, single(staff.events().getUncommittedEvents()));
    assertEquals(Identifier.ZERO, registered.registrationId());
  }

  @Test
  void updateProfileIsNoOpWhenUnchanged() {
    User user = registered();

    user.updateProfile("Ada", "Lovelace");
    assertTrue(user.events().getUncommittedEvents().isEmpty());

    clock.advance(Duration.ofMinutes(1));
    user.updateProfile("Augusta", "Lovelace");
    UserProfileUpdated updated = assertInstanceOf(UserProfileUpdated.class, single(user.events().getUncommittedEvents()));
    assertEquals("Augusta", updated.firstName());
    assertEquals(clock.instant(), user.updatedAt());
  }

  @Test
  void updateProfileValidatesNames() {
    User user = registered();

    assertThrows(ValidationException.class, () -> user.updateProfile("A", "Lovelace"));
    assertEquals("Ada", user.firstName());
  }

  @Test
  void assignRoleRecordsPreviousRole() {
    User user = registered();

    user.assignRole(Role.STAFF);
    user.assignRole(Role.STAFF);

    UserRoleAssigned assigned = assertInstanceOf(UserRoleAssigned.class, single(user.events().getUncommittedEvents()));
    assertEquals(Role.STUDENT, assigned.previousRole());
    assertEquals(Role.STAFF, assigned.role());
  }

  @Test
  void avatarCanBeSetAndRemoved() {
    User user = registered();

    user.updateAvatar("https://cdn.example.com/ada.png");
    user.updateAvatar("https://cdn.example.com/ada.png");
    user.updateAvatar(null);

    List<DomainEvent> events = user.events().getUncommittedEvents();
    assertEquals(2, events.size());
    assertNull(assertInstanceOf(UserAvatarUpdated.class, events.get(1)).avatarUrl());
    assertNull(user.avatarUrl());
    assertThrows(ValidationException.class, () -> user.updateAvatar(""));
    assertThrows(ValidationException.class, () -> user.updateAvatar("x".repeat(User.MAX_AVATAR_URL_LENGTH + 1)));
  }

  @Test
  void roleStorageValues() {
    assertEquals("aitusa", Role.AITUSA.value());
    assertEquals(Role.STAFF, Role.fromValue("staff"));
    assertEquals(Major.BIG_DATA_IN_HEALTH, Major.fromDisplayName("Big Data in Health").orElseThrow());
    assertTrue(Major.fromDisplayName("Astrology").isEmpty());
  }

  @Test
  void detailsToStringHidesHash() {
    assertFalse(details().toString().contains("$argon2id"));
  }

  private User registered() {
    Student student = Student.register(details(), Major.COMPUTER_SCIENCE, Identifier.newId(), "2023",
        Identifier.ZERO, clock);
    User user = student.user();
    user.events().clearEvents();
    return user;
  }

  private static User.Details details() {
    return new User.Details("A1234567", "ada@example.com", "Ada", "Lovelace", "$argon2id$v=19$hash");
  }

  private static DomainEvent single(List<DomainEvent> events) {
    assertEquals(1, events.size(), "events: " + events);
    return events.get(0);
  }
}
