package campus.mail;

import campus.spi.Mail;
import campus.validation.FieldErrors;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Mail templates. Every factory validates its input and throws
 * {@link campus.error.ValidationException} so a malformed event is retried and logged
 * rather than producing an unusable mail.
 */
public final class Mails {
  public static final String VERIFICATION_SUBJECT = "Email Verification Code";
  public static final String INVITATION_SUBJECT = "Staff Invitation";
  public static final String WELCOME_SUBJECT = "Welcome to Campus";

  private Mails() {
  }

  public static Mail verificationCode(String email, String code) {
    new FieldErrors()
        .requireEmail("email", email)
        .requireText("verificationCode", code)
        .throwIfAny();
    return new Mail(email, VERIFICATION_SUBJECT, "Your email verification code is: " + code);
  }

  /**
   * @param baseUrl link target without a trailing slash; the code and the recipient are appended
   */
  public static Mail staffInvitation(String baseUrl, String email, String code) {
    new FieldErrors()
        .requireEmail("email", email)
        .requireText("code", code)
        .throwIfAny();
    String link = baseUrl + "/" + code + "?email=" + URLEncoder.encode(email, StandardCharsets.UTF_8);
    return new Mail(email, INVITATION_SUBJECT,
        "You have been invited to join as staff. Please use the following link to accept the invitation:\n\n" + link);
  }

  public static Mail welcome(String email, String firstName, String lastName) {
    new FieldErrors().requireEmail("email", email).throwIfAny();
    return new Mail(email, WELCOME_SUBJECT,
        "Hello " + firstName + " " + lastName + ",\n\nWelcome to Campus! Your registration is successful.");
  }
}
