package campus.app;

import campus.Identifier;
import campus.MutableClock;
import campus.error.NotFoundException;
import campus.error.ValidationException;
import campus.user.Major;
import campus.user.Role;
import campus.user.Student;
import campus.user.User;
import campus.user.UserAvatarUpdated;
import campus.user.UserProfileUpdated;
import campus.user.UserRoleAssigned;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UserServiceTest {

  private InMemoryRepository.Users users;
  private UserService service;
  private Identifier userId;

  @BeforeEach
  void setUp() {
    MutableClock clock = MutableClock.at("2024-09-01T08:00:00Z");
    users = new InMemoryRepository.Users(clock);
    service = new UserService(users);
    Student student = Student.register(
        new User.Details("A1234567", "ada@example.com", "Ada", "Lovelace", "hash"),
        Major.COMPUTER_SCIENCE, Identifier.newId(), "2024", Identifier.ZERO, clock);
    student.events().clearEvents();
    users.save(student.user());
    userId = student.id();
  }

  @Test
  void changesArePublished() {
    service.updateProfile(userId, "Augusta", "Lovelace");
    service.assignRole(userId, Role.AITUSA);
    service.updateAvatar(userId, "https://cdn.example.com/ada.png");
    service.removeAvatar(userId);

    assertEquals(4, users.published.size());
    assertInstanceOf(UserProfileUpdated.class, users.published.get(0));
    assertInstanceOf(UserRoleAssigned.class, users.published.get(1));
    assertInstanceOf(UserAvatarUpdated.class, users.published.get(2));
    User stored = service.find(userId).orElseThrow();
    assertEquals("Augusta", stored.firstName());
    assertEquals(Role.AITUSA, stored.role());
    assertNull(stored.avatarUrl());
  }

  @Test
  void unchangedValuesPublishNothing() {
    service.updateProfile(userId, "Ada", "Lovelace");
    service.assignRole(userId, Role.STUDENT);
    service.removeAvatar(userId);

    assertTrue(users.published.isEmpty());
  }

  @Test
  void errors() {
    assertThrows(ValidationException.class, () -> service.updateProfile(userId, "", "Lovelace"));
    assertThrows(NotFoundException.class, () -> service.assignRole(Identifier.newId(), Role.STAFF));
    assertTrue(service.find(Identifier.newId()).isEmpty());
  }
}
