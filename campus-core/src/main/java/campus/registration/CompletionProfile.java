package campus.registration;

import campus.Identifier;
import campus.user.Major;
import campus.user.Role;
import campus.user.User;
import campus.validation.Validator;

/**
 * Profile submitted to complete a registration, for a student or a staff member.
 * Build one with {@link #student} or {@link #staff}.
 */
public record CompletionProfile(
    Role role,
    String verificationCode,
    String barcode,
    String firstName,
    String lastName,
    String password,
    Major major,
    Identifier groupId,
    String year
) {
  public static final int MIN_PASSWORD_LENGTH = 8;
  public static final int MAX_PASSWORD_LENGTH = 72;

  public static final Validator<CompletionProfile> VALIDATOR = (profile, errors) -> {
    errors.requireText("verificationCode", profile.verificationCode())
        .requireLength("barcode", profile.barcode(), User.MIN_BARCODE_LENGTH, User.MAX_BARCODE_LENGTH)
        .requireLength("firstName", profile.firstName(), User.MIN_NAME_LENGTH, User.MAX_NAME_LENGTH)
        .requireLength("lastName", profile.lastName(), User.MIN_NAME_LENGTH, User.MAX_NAME_LENGTH)
        .requireLength("password", profile.password(), MIN_PASSWORD_LENGTH, MAX_PASSWORD_LENGTH);
    if (profile.role() == Role.STUDENT) {
      errors.requireNonNull("major", profile.major())
          .requireId("groupId", profile.groupId())
          .requireText("year", profile.year());
    } else if (profile.role() != Role.STAFF) {
      errors.reject("role", "must be student or staff");
    }
  };

  public static CompletionProfile student(
      String verificationCode,
      String barcode,
      String firstName,
      String lastName,
      String password,
      Major major,
      Identifier groupId,
      String year) {
    return new CompletionProfile(Role.STUDENT, verificationCode, barcode, firstName, lastName,
        password, major, groupId, year);
  }

  public static CompletionProfile staff(
      String verificationCode,
      String barcode,
      String firstName,
      String lastName,
      String password) {
    return new CompletionProfile(Role.STAFF, verificationCode, barcode, firstName, lastName,
        password, null, null, null);
  }

  @Override
  public String toString() {
    return "CompletionProfile[role=" + role + ", barcode=" + barcode + "]";
  }
}
