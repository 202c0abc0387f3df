package campus.registration;

import campus.Aggregate;
import campus.Identifier;
import campus.error.CodeExpiredException;
import campus.error.InvalidCodeException;
import campus.error.InvalidStateException;
import campus.error.TooManyAttemptsException;
import campus.error.TooSoonException;
import campus.event.EventHeader;
import campus.event.EventRecorder;
import campus.event.Recorder;
import campus.event.TracingCarrier;
import campus.spi.PasswordHasher;
import campus.util.Times;
import campus.validation.FieldErrors;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Email registration verified by a one-time code.
 *
 * <p>A registration starts {@link RegistrationStatus#PENDING} with a random code valid for
 * {@link RegistrationPolicy#codeTtl()}. The code is confirmed with {@link #verifyCode},
 * after which the registration is completed with a student or staff profile. Each
 * transition records one event; repeating a transition that changes nothing records none.
 */
public final class Registration implements Aggregate {
  public static final String EVENT_STREAM = "events_registration";

  static final String TOO_MANY_ATTEMPTS = "too many failed attempts";

  private final Recorder recorder = new Recorder();
  private final RegistrationPolicy policy;
  private final Clock clock;

  private final Identifier id;
  private final String email;
  private RegistrationStatus status;
  private String verificationCode;
  private int codeAttempts;
  private Instant codeExpiresAt;
  private Instant resendTimeout;
  private final Instant createdAt;
  private Instant updatedAt;

  /**
   * Stored form of a registration.
   */
  public record Snapshot(
      Identifier id,
      String email,
      RegistrationStatus status,
      String verificationCode,
      int codeAttempts,
      Instant codeExpiresAt,
      Instant resendTimeout,
      Instant createdAt,
      Instant updatedAt
  ) {
  }

  private Registration(Snapshot s, RegistrationPolicy policy, Clock clock) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.id = s.id();
    this.email = s.email();
    this.status = s.status();
    this.verificationCode = s.verificationCode();
    this.codeAttempts = s.codeAttempts();
    this.codeExpiresAt = s.codeExpiresAt();
    this.resendTimeout = s.resendTimeout();
    this.createdAt = s.createdAt();
    this.updatedAt = s.updatedAt();
  }

  /**
   * Starts a registration for {@code email} and records {@link RegistrationStarted}.
   *
   * @throws campus.error.ValidationException if the email is missing, too long or malformed
   */
  public static Registration start(String email, RegistrationPolicy policy, Clock clock) {
    new FieldErrors().requireEmail("email", email).throwIfAny();

    Instant now = Times.now(clock);
    Registration registration = new Registration(new Snapshot(
        Identifier.newId(),
        email,
        RegistrationStatus.PENDING,
        policy.newCode(),
        0,
        now.plus(policy.codeTtl()),
        now.plus(policy.resendCooldown()),
        now,
        now), policy, clock);

    registration.recorder.addEvent(new RegistrationStarted(
        EventHeader.create(now),
        TracingCarrier.current(),
        registration.id,
        email,
        registration.verificationCode));
    return registration;
  }

  /** Rebuilds a stored registration without validation. Used by repositories only. */
  public static Registration rehydrate(Snapshot snapshot, RegistrationPolicy policy, Clock clock) {
    return new Registration(snapshot, policy, clock);
  }

  /**
   * Confirms the verification code.
   *
   * <p>A mismatch counts as a failed attempt. Once {@link RegistrationPolicy#maxAttempts()}
   * attempts failed the registration expires and records {@link RegistrationFailed}. Both
   * mismatch errors are persistable so the attempt counter survives the rejected call.
   *
   * @throws InvalidStateException     unless pending (or already verified with this code)
   * @throws CodeExpiredException      after {@code codeExpiresAt}, whatever the code
   * @throws InvalidCodeException      on a mismatch with attempts left
   * @throws TooManyAttemptsException  on the last allowed mismatch
   */
  public void verifyCode(String code) {
    if (status == RegistrationStatus.VERIFIED && codeMatches(code)) {
      return;
    }
    if (status != RegistrationStatus.PENDING) {
      throw new InvalidStateException("can only verify pending registrations");
    }

    Instant now = Times.now(clock);
    if (now.isAfter(codeExpiresAt)) {
      throw new CodeExpiredException();
    }

    if (!codeMatches(code)) {
      codeAttempts++;
      updatedAt = now;
      if (codeAttempts >= policy.maxAttempts()) {
        status = RegistrationStatus.EXPIRED;
        recorder.addEvent(new RegistrationFailed(
            EventHeader.create(now), TracingCarrier.current(), id, TOO_MANY_ATTEMPTS));
        throw new TooManyAttemptsException();
      }
      throw new InvalidCodeException(true);
    }

    status = RegistrationStatus.VERIFIED;
    updatedAt = now;
    recorder.addEvent(new RegistrationVerified(
        EventHeader.create(now), TracingCarrier.current(), id, email));
  }

  /**
   * Replaces the code, restarts its lifetime and resets the attempt counter.
   *
   * @throws TooSoonException      before the resend cooldown elapsed
   * @throws InvalidStateException once verified or completed
   */
  public void resendCode() {
    Instant now = Times.now(clock);
    if (now.isBefore(resendTimeout)) {
      throw new TooSoonException(Duration.between(now, resendTimeout));
    }
    if (status == RegistrationStatus.VERIFIED || status == RegistrationStatus.COMPLETED) {
      throw new InvalidStateException("registration is already " + status.value());
    }

    verificationCode = policy.newCode();
    codeExpiresAt = now.plus(policy.codeTtl());
    resendTimeout = now.plus(policy.resendCooldown());
    codeAttempts = 0;
    status = RegistrationStatus.PENDING;
    updatedAt = now;

    recorder.addEvent(new RegistrationCodeResent(
        EventHeader.create(now), TracingCarrier.current(), id, email, verificationCode));
  }

  /**
   * Completes a verified registration and records {@link RegistrationCompleted} carrying
   * the hashed password.
   *
   * @throws InvalidStateException           unless verified
   * @throws InvalidCodeException            if the profile's code does not match (not persistable)
   * @throws campus.error.ValidationException if the profile is invalid
   */
  public void complete(CompletionProfile profile, PasswordHasher hasher) {
    Objects.requireNonNull(profile, "profile");
    Objects.requireNonNull(hasher, "hasher");
    if (status != RegistrationStatus.VERIFIED) {
      throw new InvalidStateException("can only complete verified registrations");
    }
    if (!codeMatches(profile.verificationCode())) {
      throw new InvalidCodeException(false);
    }
    CompletionProfile.VALIDATOR.check(profile);

    String passwordHash = hasher.hash(profile.password());
    Instant now = Times.now(clock);
    status = RegistrationStatus.COMPLETED;
    updatedAt = now;

    recorder.addEvent(new RegistrationCompleted(
        EventHeader.create(now),
        TracingCarrier.current(),
        id,
        profile.role(),
        email,
        profile.barcode(),
        profile.firstName(),
        profile.lastName(),
        passwordHash,
        profile.major(),
        profile.groupId(),
        profile.year()));
  }

  /**
   * Status as seen now: a pending registration whose code lifetime is over reads as
   * {@link RegistrationStatus#EXPIRED}.
   */
  public RegistrationStatus currentStatus() {
    if (status == RegistrationStatus.PENDING && Times.now(clock).isAfter(codeExpiresAt)) {
      return RegistrationStatus.EXPIRED;
    }
    return status;
  }

  public boolean isCompleted() {
    return status == RegistrationStatus.COMPLETED;
  }

  private boolean codeMatches(String code) {
    if (code == null) {
      return false;
    }
    return MessageDigest.isEqual(
        verificationCode.getBytes(StandardCharsets.UTF_8),
        code.getBytes(StandardCharsets.UTF_8));
  }

  public Snapshot snapshot() {
    return new Snapshot(id, email, status, verificationCode, codeAttempts, codeExpiresAt,
        resendTimeout, createdAt, updatedAt);
  }

  @Override
  public Identifier id() {
    return id;
  }

  @Override
  public EventRecorder events() {
    return recorder;
  }

  public String email() {
    return email;
  }

  /** Stored status; see {@link #currentStatus()} for the time-aware view. */
  public RegistrationStatus status() {
    return status;
  }

  public String verificationCode() {
    return verificationCode;
  }

  public int codeAttempts() {
    return codeAttempts;
  }

  public Instant codeExpiresAt() {
    return codeExpiresAt;
  }

  public Instant resendTimeout() {
    return resendTimeout;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public Instant updatedAt() {
    return updatedAt;
  }
}
