package campus.app;

import campus.Identifier;
import campus.error.AlreadyExistsException;
import campus.error.InvalidInvitationException;
import campus.error.NotFoundException;
import campus.invitation.StaffInvitation;
import campus.invitation.StaffInvitationRepository;
import campus.registration.CompletionProfile;
import campus.spi.PasswordHasher;
import campus.user.Staff;
import campus.user.StaffRepository;
import campus.user.User;
import campus.user.UserRepository;
import campus.validation.FieldErrors;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Staff invitation use cases. Mutations are restricted to the invitation's creator; any
 * recipient holding the code may accept and gets a staff account immediately.
 */
public final class StaffInvitationService {
  private static final String RESOURCE = "staff invitation";

  private final StaffInvitationRepository invitations;
  private final UserRepository users;
  private final StaffRepository staff;
  private final PasswordHasher hasher;
  private final Clock clock;

  public StaffInvitationService(
      StaffInvitationRepository invitations,
      UserRepository users,
      StaffRepository staff,
      PasswordHasher hasher,
      Clock clock) {
    this.invitations = Objects.requireNonNull(invitations, "invitations");
    this.users = Objects.requireNonNull(users, "users");
    this.staff = Objects.requireNonNull(staff, "staff");
    this.hasher = Objects.requireNonNull(hasher, "hasher");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * @param validFrom  optional start of the validity window
   * @param validUntil optional end of the validity window
   * @return id of the new invitation
   */
  public Identifier create(Identifier creatorId, List<String> recipients, Instant validFrom, Instant validUntil) {
    return Services.guard("create staff invitation", () -> {
      StaffInvitation invitation = StaffInvitation.create(creatorId, recipients, validFrom, validUntil, clock);
      invitations.save(invitation);
      return invitation.id();
    });
  }

  public void updateRecipients(Identifier callerId, Identifier invitationId, List<String> recipients) {
    Services.run("update staff invitation recipients", () ->
        invitations.update(invitationId, invitation -> invitation.updateRecipients(callerId, recipients)));
  }

  public void updateValidity(Identifier callerId, Identifier invitationId, Instant validFrom, Instant validUntil) {
    Services.run("update staff invitation validity", () ->
        invitations.update(invitationId, invitation -> invitation.updateValidity(callerId, validFrom, validUntil)));
  }

  public void delete(Identifier callerId, Identifier invitationId) {
    Services.run("delete staff invitation", () ->
        invitations.update(invitationId, invitation -> invitation.markDeleted(callerId)));
  }

  /**
   * Checks that {@code email} may accept the invitation identified by {@code code}.
   *
   * @throws InvalidInvitationException on an empty input, an unknown recipient or a wrong code
   * @throws NotFoundException          if no invitation has this code or it was deleted
   */
  public void validateAccess(String email, String code) {
    Services.run("validate staff invitation", () -> {
      if (email == null || email.isEmpty() || code == null || code.isEmpty()) {
        throw new InvalidInvitationException();
      }
      StaffInvitation invitation = invitations.findByCode(code)
          .orElseThrow(() -> new NotFoundException(RESOURCE));
      invitation.validateInvitationAccess(email, code);
    });
  }

  /**
   * Creates the staff account of an invited recipient.
   *
   * @return id of the new staff member
   * @throws campus.error.ValidationException for malformed fields or a password outside
   *                                          8 to 72 characters
   * @throws NotFoundException                if no invitation has this code or it was deleted
   * @throws InvalidInvitationException       if {@code email} is not a recipient
   * @throws AlreadyExistsException           if the email or barcode belongs to another user
   */
  public Identifier accept(
      String email,
      String code,
      String barcode,
      String firstName,
      String lastName,
      String password) {
    return Services.guard("accept staff invitation", () -> {
      new FieldErrors()
          .requireEmail("email", email)
          .requireText("code", code)
          .requireLength("password", password,
              CompletionProfile.MIN_PASSWORD_LENGTH, CompletionProfile.MAX_PASSWORD_LENGTH)
          .throwIfAny();
      String normalized = email.toLowerCase(Locale.ROOT);

      StaffInvitation invitation = invitations.findByCode(code)
          .orElseThrow(() -> new NotFoundException(RESOURCE));
      invitation.validateInvitationAccess(normalized, code);

      if (users.existsByEmail(normalized)) {
        throw new AlreadyExistsException("user with this email already exists");
      }
      if (barcode != null && users.existsByBarcode(barcode)) {
        throw new AlreadyExistsException("user with this barcode already exists");
      }

      Staff member = Staff.acceptInvitation(
          new User.Details(barcode, normalized, firstName, lastName, hasher.hash(password)),
          invitation.id(),
          clock);
      staff.save(member);
      return member.id();
    });
  }
}
