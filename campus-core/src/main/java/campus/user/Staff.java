package campus.user;

import campus.Aggregate;
import campus.Identifier;
import campus.event.EventHeader;
import campus.event.EventRecorder;
import campus.event.TracingCarrier;
import campus.validation.FieldErrors;

import java.time.Clock;
import java.util.Objects;

/**
 * A user with the {@link Role#STAFF} role.
 */
public final class Staff implements Aggregate {
  public static final String EVENT_STREAM = "events_staff";

  private final User user;

  private Staff(User user) {
    this.user = user;
  }

  /**
   * Registers a staff member and records {@link StaffRegistered}.
   *
   * @throws campus.error.ValidationException if any user field is invalid
   */
  public static Staff register(User.Details details, Identifier registrationId, Clock clock) {
    FieldErrors errors = new FieldErrors();
    User.validate(details, errors);
    errors.throwIfAny();

    User user = User.register(details, Role.STAFF, clock);
    user.recorder().addEvent(new StaffRegistered(
        EventHeader.create(user.createdAt()),
        TracingCarrier.current(),
        user.id(),
        user.barcode(),
        user.username(),
        Objects.requireNonNullElse(registrationId, Identifier.ZERO),
        user.email(),
        user.firstName(),
        user.lastName()));
    return new Staff(user);
  }

  /**
   * Creates the account of an invited staff member and records {@link StaffInvitationAccepted}.
   * The invitation must have been checked by the caller.
   *
   * @throws campus.error.ValidationException if any user field is invalid or the invitation id is missing
   */
  public static Staff acceptInvitation(User.Details details, Identifier invitationId, Clock clock) {
    FieldErrors errors = new FieldErrors().requireId("invitationId", invitationId);
    User.validate(details, errors);
    errors.throwIfAny();

    User user = User.register(details, Role.STAFF, clock);
    user.recorder().addEvent(new StaffInvitationAccepted(
        EventHeader.create(user.createdAt()),
        TracingCarrier.current(),
        user.id(),
        user.barcode(),
        user.username(),
        invitationId,
        user.email(),
        user.firstName(),
        user.lastName()));
    return new Staff(user);
  }

  public static Staff rehydrate(User.Snapshot snapshot, Clock clock) {
    return new Staff(User.rehydrate(snapshot, clock));
  }

  @Override
  public Identifier id() {
    return user.id();
  }

  @Override
  public EventRecorder events() {
    return user.events();
  }

  public User user() {
    return user;
  }
}
