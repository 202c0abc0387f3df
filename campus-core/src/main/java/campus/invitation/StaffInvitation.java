package campus.invitation;

import campus.Aggregate;
import campus.Identifier;
import campus.error.ForbiddenException;
import campus.error.InvalidInvitationException;
import campus.error.NotFoundException;
import campus.event.EventHeader;
import campus.event.EventRecorder;
import campus.event.Recorder;
import campus.event.TracingCarrier;
import campus.util.RandomCodes;
import campus.util.Times;
import campus.validation.FieldErrors;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Invitation for staff members to register, addressed to a list of emails and optionally
 * limited to a validity window.
 *
 * <p>Recipients are stored lowercased, and access checks ignore the case of the email.
 * Only the creator may change or delete an invitation. A deleted invitation is frozen
 * and reads as not found to everyone, including access checks.
 */
public final class StaffInvitation implements Aggregate {
  public static final String EVENT_STREAM = "events_staff_invitation";
  public static final int MAX_RECIPIENTS = 25;
  public static final int CODE_LENGTH = 10;
  public static final Duration MIN_VALIDITY = Duration.ofMinutes(1);

  static final String RESOURCE = "staff invitation";

  private final Recorder recorder = new Recorder();
  private final Clock clock;

  private final Identifier id;
  private final String code;
  private List<String> recipients;
  private Instant validFrom;
  private Instant validUntil;
  private final Identifier creatorId;
  private final Instant createdAt;
  private Instant updatedAt;
  private Instant deletedAt;

  /**
   * Stored form of an invitation. {@code validFrom}, {@code validUntil} and
   * {@code deletedAt} may be null.
   */
  public record Snapshot(
      Identifier id,
      String code,
      List<String> recipients,
      Instant validFrom,
      Instant validUntil,
      Identifier creatorId,
      Instant createdAt,
      Instant updatedAt,
      Instant deletedAt
  ) {
    public Snapshot {
      recipients = List.copyOf(recipients);
    }
  }

  private StaffInvitation(Snapshot s, Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.id = s.id();
    this.code = s.code();
    this.recipients = s.recipients();
    this.validFrom = s.validFrom();
    this.validUntil = s.validUntil();
    this.creatorId = s.creatorId();
    this.createdAt = s.createdAt();
    this.updatedAt = s.updatedAt();
    this.deletedAt = s.deletedAt();
  }

  /**
   * Creates an invitation with a fresh 10-character code and records
   * {@link StaffInvitationCreated}.
   *
   * @throws campus.error.ValidationException for a missing creator, invalid recipients or an
   *                                          invalid validity window
   */
  public static StaffInvitation create(
      Identifier creatorId,
      List<String> recipients,
      Instant validFrom,
      Instant validUntil,
      Clock clock) {
    Instant now = Times.now(clock);
    recipients = normalize(recipients);
    FieldErrors errors = new FieldErrors().requireId("creatorId", creatorId);
    validateRecipients(recipients, errors);
    validateValidity(validFrom, validUntil, now, errors);
    errors.throwIfAny();

    StaffInvitation invitation = new StaffInvitation(new Snapshot(
        Identifier.newId(),
        RandomCodes.alphanumeric(CODE_LENGTH),
        recipients,
        validFrom,
        validUntil,
        creatorId,
        now,
        now,
        null), clock);

    invitation.recorder.addEvent(new StaffInvitationCreated(
        EventHeader.create(now),
        TracingCarrier.current(),
        invitation.id,
        invitation.code,
        invitation.recipients,
        validFrom,
        validUntil,
        creatorId));
    return invitation;
  }

  /** Rebuilds a stored invitation without validation. Used by repositories only. */
  public static StaffInvitation rehydrate(Snapshot snapshot, Clock clock) {
    return new StaffInvitation(snapshot, clock);
  }

  /**
   * Replaces the recipient list. A list holding the same emails as the current one, in any
   * order, changes nothing and records no event.
   *
   * @throws ForbiddenException              unless {@code callerId} is the creator
   * @throws NotFoundException               if deleted
   * @throws campus.error.ValidationException for more than {@value #MAX_RECIPIENTS} emails,
   *                                          duplicates or malformed emails
   */
  public void updateRecipients(Identifier callerId, List<String> emails) {
    requireMutableBy(callerId);
    emails = normalize(emails);
    FieldErrors errors = new FieldErrors();
    validateRecipients(emails, errors);
    errors.throwIfAny();

    Set<String> previous = new HashSet<>(recipients);
    if (emails.size() == recipients.size() && previous.containsAll(emails)) {
      return;
    }

    List<String> added = new ArrayList<>();
    for (String email : emails) {
      if (!previous.contains(email)) {
        added.add(email);
      }
    }

    Instant now = Times.now(clock);
    recipients = List.copyOf(emails);
    updatedAt = now;
    recorder.addEvent(new RecipientsUpdated(
        EventHeader.create(now), TracingCarrier.current(), id, code, added, recipients));
  }

  /**
   * Replaces the validity window. Values equal to the current ones at second precision
   * change nothing and record no event.
   *
   * @throws ForbiddenException              unless {@code callerId} is the creator
   * @throws NotFoundException               if deleted
   * @throws campus.error.ValidationException if a bound is in the past or the window is
   *                                          shorter than {@link #MIN_VALIDITY}
   */
  public void updateValidity(Identifier callerId, Instant from, Instant until) {
    requireMutableBy(callerId);
    Instant now = Times.now(clock);
    FieldErrors errors = new FieldErrors();
    validateValidity(from, until, now, errors);
    errors.throwIfAny();

    if (sameSecond(validFrom, from) && sameSecond(validUntil, until)) {
      return;
    }

    validFrom = from;
    validUntil = until;
    updatedAt = now;
    recorder.addEvent(new ValidityUpdated(
        EventHeader.create(now), TracingCarrier.current(), id, validFrom, validUntil));
  }

  /**
   * Soft-deletes the invitation. Deleting twice is a silent no-op.
   *
   * @throws ForbiddenException unless {@code callerId} is the creator
   */
  public void markDeleted(Identifier callerId) {
    if (!creatorId.equals(callerId)) {
      throw new ForbiddenException("only the creator may delete the invitation");
    }
    if (deletedAt != null) {
      return;
    }

    Instant now = Times.now(clock);
    deletedAt = now;
    updatedAt = now;
    recorder.addEvent(new StaffInvitationDeleted(EventHeader.create(now), TracingCarrier.current(), id));
  }

  /**
   * Checks that {@code email} was invited with {@code code}. Deletion is checked first so
   * a deleted invitation never reveals whether the pair would have matched.
   *
   * @throws NotFoundException          if deleted
   * @throws InvalidInvitationException on an empty email or code, a code mismatch or an
   *                                    email that is not a recipient
   */
  public void validateInvitationAccess(String email, String code) {
    if (deletedAt != null) {
      throw new NotFoundException(RESOURCE);
    }
    if (email == null || email.isEmpty() || code == null || code.isEmpty()) {
      throw new InvalidInvitationException();
    }
    if (!this.code.equals(code) || !recipients.contains(email.toLowerCase(Locale.ROOT))) {
      throw new InvalidInvitationException();
    }
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  private void requireMutableBy(Identifier callerId) {
    if (!creatorId.equals(callerId)) {
      throw new ForbiddenException("only the creator may modify the invitation");
    }
    if (deletedAt != null) {
      throw new NotFoundException(RESOURCE);
    }
  }

  private static List<String> normalize(List<String> emails) {
    if (emails == null) {
      return null;
    }
    List<String> normalized = new ArrayList<>(emails.size());
    for (String email : emails) {
      normalized.add(email == null ? null : email.toLowerCase(Locale.ROOT));
    }
    return normalized;
  }

  static void validateRecipients(List<String> emails, FieldErrors errors) {
    if (emails == null) {
      errors.reject("recipients", "is required");
      return;
    }
    if (emails.size() > MAX_RECIPIENTS) {
      errors.reject("recipients", "the length must be no more than " + MAX_RECIPIENTS);
    }
    Set<String> seen = new HashSet<>();
    for (String email : emails) {
      if (email != null && !seen.add(email)) {
        errors.reject("recipients", "must not contain duplicates");
        break;
      }
    }
    for (int i = 0; i < emails.size(); i++) {
      errors.requireEmail("recipients[" + i + "]", emails.get(i));
    }
  }

  static void validateValidity(Instant from, Instant until, Instant now, FieldErrors errors) {
    if (from != null && from.isBefore(now)) {
      errors.reject("validFrom", "the time must be in the future");
    }
    if (until != null) {
      if (until.isBefore(now)) {
        errors.reject("validUntil", "the time must be in the future");
      } else if (from != null && until.isBefore(from.plus(MIN_VALIDITY))) {
        errors.reject("validUntil", "the time must be at least " + MIN_VALIDITY.toMinutes()
            + " minute after the start time");
      }
    }
  }

  private static boolean sameSecond(Instant current, Instant candidate) {
    if (current == null || candidate == null) {
      return current == candidate;
    }
    return current.truncatedTo(ChronoUnit.SECONDS).equals(candidate.truncatedTo(ChronoUnit.SECONDS));
  }

  public Snapshot snapshot() {
    return new Snapshot(id, code, recipients, validFrom, validUntil, creatorId, createdAt,
        updatedAt, deletedAt);
  }

  @Override
  public Identifier id() {
    return id;
  }

  @Override
  public EventRecorder events() {
    return recorder;
  }

  public String code() {
    return code;
  }

  public List<String> recipients() {
    return recipients;
  }

  public Instant validFrom() {
    return validFrom;
  }

  public Instant validUntil() {
    return validUntil;
  }

  public Identifier creatorId() {
    return creatorId;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }

  public Instant deletedAt() {
    return deletedAt;
  }
}
