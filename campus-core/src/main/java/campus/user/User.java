package campus.user;

import campus.Aggregate;
import campus.Identifier;
import campus.event.EventHeader;
import campus.event.EventRecorder;
import campus.event.Recorder;
import campus.event.TracingCarrier;
import campus.util.Times;
import campus.validation.FieldErrors;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Account of a person in the organization. {@link Student} and {@link Staff} hold a user
 * by composition and share its event recorder.
 */
public final class User implements Aggregate {
  public static final String EVENT_STREAM = "events_user";

  public static final int MIN_NAME_LENGTH = 2;
  public static final int MAX_NAME_LENGTH = 100;
  public static final int MIN_BARCODE_LENGTH = 6;
  public static final int MAX_BARCODE_LENGTH = 100;
  public static final int MAX_AVATAR_URL_LENGTH = 1000;

  private final Recorder recorder = new Recorder();
  private final Clock clock;

  private final Identifier id;
  private final String barcode;
  private final String username;
  private final String email;
  private String firstName;
  private String lastName;
  private String avatarUrl;
  private Role role;
  private final String passwordHash;
  private final Instant createdAt;
  private Instant updatedAt;

  /** Stored form of a user. {@code avatarUrl} may be null. */
  public record Snapshot(
      Identifier id,
      String barcode,
      String username,
      String email,
      String firstName,
      String lastName,
      String avatarUrl,
      Role role,
      String passwordHash,
      Instant createdAt,
      Instant updatedAt
  ) {
  }

  /** Validated input of a new account. */
  public record Details(String barcode, String email, String firstName, String lastName, String passwordHash) {

    @Override
    public String toString() {
      return "Details[barcode=" + barcode + ", email=" + email + "]";
    }
  }

  private User(Snapshot s, Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.id = s.id();
    this.barcode = s.barcode();
    this.username = s.username();
    this.email = s.email();
    this.firstName = s.firstName();
    this.lastName = s.lastName();
    this.avatarUrl = s.avatarUrl();
    this.role = s.role();
    this.passwordHash = s.passwordHash();
    this.createdAt = s.createdAt();
    this.updatedAt = s.updatedAt();
  }

  static User register(Details details, Role role, Clock clock) {
    Instant now = Times.now(clock);
    return new User(new Snapshot(
        Identifier.newId(),
        details.barcode(),
        details.barcode(),
        details.email(),
        details.firstName(),
        details.lastName(),
        null,
        role,
        details.passwordHash(),
        now,
        now), clock);
  }

  static void validate(Details details, FieldErrors errors) {
    errors.requireLength("barcode", details.barcode(), MIN_BARCODE_LENGTH, MAX_BARCODE_LENGTH)
        .requireEmail("email", details.email())
        .requireLength("firstName", details.firstName(), MIN_NAME_LENGTH, MAX_NAME_LENGTH)
        .requireLength("lastName", details.lastName(), MIN_NAME_LENGTH, MAX_NAME_LENGTH)
        .requireText("passwordHash", details.passwordHash());
  }

  /** Rebuilds a stored user without validation. Used by repositories only. */
  public static User rehydrate(Snapshot snapshot, Clock clock) {
    return new User(snapshot, clock);
  }

  /**
   * Changes first and last name, recording {@link UserProfileUpdated} unless both are
   * unchanged.
   *
   * @throws campus.error.ValidationException if a name is blank or not 2-100 characters
   */
  public void updateProfile(String firstName, String lastName) {
    new FieldErrors()
        .requireLength("firstName", firstName, MIN_NAME_LENGTH, MAX_NAME_LENGTH)
        .requireLength("lastName", lastName, MIN_NAME_LENGTH, MAX_NAME_LENGTH)
        .throwIfAny();
    if (firstName.equals(this.firstName) && lastName.equals(this.lastName)) {
      return;
    }

    Instant now = Times.now(clock);
    this.firstName = firstName;
    this.lastName = lastName;
    this.updatedAt = now;
    recorder.addEvent(new UserProfileUpdated(
        EventHeader.create(now), TracingCarrier.current(), id, firstName, lastName));
  }

  /**
   * Assigns {@code role}, recording {@link UserRoleAssigned} unless it is the current one.
   */
  public void assignRole(Role role) {
    new FieldErrors().requireNonNull("role", role).throwIfAny();
    if (role == this.role) {
      return;
    }

    Instant now = Times.now(clock);
    Role previous = this.role;
    this.role = role;
    this.updatedAt = now;
    recorder.addEvent(new UserRoleAssigned(
        EventHeader.create(now), TracingCarrier.current(), id, previous, role));
  }

  /**
   * Sets the avatar URL, or removes it when {@code avatarUrl} is null.
   *
   * @throws campus.error.ValidationException if the URL is empty or longer than 1000 characters
   */
  public void updateAvatar(String avatarUrl) {
    new FieldErrors().optionalLength("avatarUrl", avatarUrl, 1, MAX_AVATAR_URL_LENGTH).throwIfAny();
    if (Objects.equals(avatarUrl, this.avatarUrl)) {
      return;
    }

    Instant now = Times.now(clock);
    this.avatarUrl = avatarUrl;
    this.updatedAt = now;
    recorder.addEvent(new UserAvatarUpdated(
        EventHeader.create(now), TracingCarrier.current(), id, avatarUrl));
  }

  Instant now() {
    return Times.now(clock);
  }

  Recorder recorder() {
    return recorder;
  }

  public Snapshot snapshot() {
    return new Snapshot(id, barcode, username, email, firstName, lastName, avatarUrl, role,
        passwordHash, createdAt, updatedAt);
  }

  @Override
  public Identifier id() {
    return id;
  }

  @Override
  public EventRecorder events() {
    return recorder;
  }

  public String barcode() {
    return barcode;
  }

  public String username() {
    return username;
  }

  public String email() {
    return email;
  }

  public String firstName() {
    return firstName;
  }

  public String lastName() {
    return lastName;
  }

  public String avatarUrl() {
    return avatarUrl;
  }

  public Role role() {
    return role;
  }

  public String passwordHash() {
    return passwordHash;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }
}
