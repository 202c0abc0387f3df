package campus.validation;

import campus.Identifier;
import campus.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldErrorsTest {

  @Test
  void keepsFirstErrorPerField() {
    FieldErrors errors = new FieldErrors()
        .reject("email", "is required")
        .reject("email", "must be a valid email address")
        .reject("name", "is required");

    assertEquals(2, errors.toList().size());
    assertEquals("is required", errors.toList().get(0).message());
  }

  @Test
  void throwIfAnyCarriesAllFields() {
    FieldErrors errors = new FieldErrors()
        .requireText("code", " ")
        .requireId("groupId", Identifier.ZERO)
        .requireLength("firstName", "A", 2, 100);

    ValidationException e = assertThrows(ValidationException.class, errors::throwIfAny);

    assertEquals("validation_failed", e.code());
    assertFalse(e.persistable());
    assertEquals(3, e.errors().size());
    assertTrue(e.getMessage().contains("firstName: the length must be between 2 and 100"));
  }

  @Test
  void noErrorsNoThrow() {
    new FieldErrors()
        .requireEmail("email", "ada@example.com")
        .optionalLength("avatarUrl", null, 1, 1000)
        .requireNonNull("role", "student")
        .throwIfAny();
  }

  @Test
  void emailRules() {
    assertTrue(Emails.isWellFormed("ada.lovelace+campus@mail.example.org"));
    assertFalse(Emails.isWellFormed("ada@localhost"));
    assertFalse(Emails.isWellFormed("ada@@example.com"));
    assertFalse(Emails.isWellFormed("a".repeat(250) + "@example.com"));

    FieldErrors tooLong = new FieldErrors().requireEmail("email", "a".repeat(250) + "@example.com");
    assertEquals("the length must be no more than 254", tooLong.toList().get(0).message());
  }
}
