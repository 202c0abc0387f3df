package campus.app;

import campus.Identifier;
import campus.error.AlreadyExistsException;
import campus.error.NotFoundException;
import campus.registration.CompletionProfile;
import campus.registration.Registration;
import campus.registration.RegistrationPolicy;
import campus.registration.RegistrationRepository;
import campus.spi.PasswordHasher;
import campus.user.Major;
import campus.user.UserRepository;
import campus.validation.FieldErrors;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Email registration use cases.
 *
 * <p>Each call is a single repository transaction. Verification mails are sent by the
 * mail handlers once the events are committed, never from here.
 */
public final class RegistrationService {
  private static final Logger logger = Logger.getLogger(RegistrationService.class.getName());

  static final String RESOURCE = "registration";

  private final RegistrationRepository registrations;
  private final UserRepository users;
  private final PasswordHasher hasher;
  private final RegistrationPolicy policy;
  private final Clock clock;

  public RegistrationService(
      RegistrationRepository registrations,
      UserRepository users,
      PasswordHasher hasher,
      RegistrationPolicy policy,
      Clock clock) {
    this.registrations = Objects.requireNonNull(registrations, "registrations");
    this.users = Objects.requireNonNull(users, "users");
    this.hasher = Objects.requireNonNull(hasher, "hasher");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Starts a registration, or resends the code of an unfinished one.
   *
   * @return id of the new or existing registration
   * @throws AlreadyExistsException if a user or a completed registration has this email,
   *                                or a concurrent call registered it first
   * @throws campus.error.TooSoonException for a resend within the cooldown
   */
  public Identifier start(String email) {
    return Services.guard("start registration", () -> {
      new FieldErrors().requireEmail("email", email).throwIfAny();
      if (users.existsByEmail(email)) {
        throw new AlreadyExistsException("user with this email already exists");
      }

      Registration existing = registrations.findByEmail(email).orElse(null);
      if (existing == null) {
        Registration registration = Registration.start(email, policy, clock);
        registrations.save(registration);
        logger.fine("Started registration " + registration.id());
        return registration.id();
      }
      if (existing.isCompleted()) {
        throw new AlreadyExistsException("user with this email is already registered");
      }
      registrations.update(existing.id(), Registration::resendCode);
      return existing.id();
    });
  }

  public void verifyCode(String email, String code) {
    Services.run("verify registration code", () -> {
      new FieldErrors()
          .requireEmail("email", email)
          .requireText("code", code)
          .throwIfAny();
      registrations.update(require(email), registration -> registration.verifyCode(code));
    });
  }

  public void resendCode(String email) {
    Services.run("resend registration code", () -> {
      new FieldErrors().requireEmail("email", email).throwIfAny();
      registrations.update(require(email), Registration::resendCode);
    });
  }

  /**
   * Completes a verified registration as a student. The student account is created
   * asynchronously from the resulting event.
   */
  public void completeStudent(
      String email,
      String verificationCode,
      String barcode,
      String firstName,
      String lastName,
      String password,
      Major major,
      Identifier groupId,
      String year) {
    complete(email, CompletionProfile.student(
        verificationCode, barcode, firstName, lastName, password, major, groupId, year));
  }

  public void completeStaff(
      String email,
      String verificationCode,
      String barcode,
      String firstName,
      String lastName,
      String password) {
    complete(email, CompletionProfile.staff(verificationCode, barcode, firstName, lastName, password));
  }

  private void complete(String email, CompletionProfile profile) {
    Services.run("complete registration", () -> {
      new FieldErrors().requireEmail("email", email).throwIfAny();
      if (users.existsByEmail(email)) {
        throw new AlreadyExistsException("user with this email already exists");
      }
      if (profile.barcode() != null && users.existsByBarcode(profile.barcode())) {
        throw new AlreadyExistsException("user with this barcode already exists");
      }
      registrations.update(require(email), registration -> registration.complete(profile, hasher));
    });
  }

  private Identifier require(String email) {
    return registrations.findByEmail(email)
        .map(Registration::id)
        .orElseThrow(() -> new NotFoundException(RESOURCE));
  }
}
