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
 * A user enrolled in a major and a group. Events of the embedded {@link User} and of the
 * student share one recorder.
 */
public final class Student implements Aggregate {
  public static final String EVENT_STREAM = "events_student";

  private final User user;
  private final Major major;
  private final Identifier groupId;
  private final String year;

  public record Snapshot(User.Snapshot user, Major major, Identifier groupId, String year) {
  }

  private Student(User user, Major major, Identifier groupId, String year) {
    this.user = user;
    this.major = major;
    this.groupId = groupId;
    this.year = year;
  }

  /**
   * Registers a student and records {@link StudentRegistered}.
   *
   * @param registrationId registration the student came from; may be {@link Identifier#ZERO}
   * @throws campus.error.ValidationException if any user or student field is invalid
   */
  public static Student register(
      User.Details details,
      Major major,
      Identifier groupId,
      String year,
      Identifier registrationId,
      Clock clock) {
    FieldErrors errors = new FieldErrors();
    User.validate(details, errors);
    errors.requireNonNull("major", major)
        .requireId("groupId", groupId)
        .requireText("year", year)
        .throwIfAny();

    User user = User.register(details, Role.STUDENT, clock);
    Student student = new Student(user, major, groupId, year);
    user.recorder().addEvent(new StudentRegistered(
        EventHeader.create(user.createdAt()),
        TracingCarrier.current(),
        user.id(),
        user.barcode(),
        user.username(),
        Objects.requireNonNullElse(registrationId, Identifier.ZERO),
        user.email(),
        user.firstName(),
        user.lastName(),
        groupId,
        major,
        year));
    return student;
  }

  public static Student rehydrate(Snapshot snapshot, Clock clock) {
    return new Student(User.rehydrate(snapshot.user(), clock), snapshot.major(),
        snapshot.groupId(), snapshot.year());
  }

  public Snapshot snapshot() {
    return new Snapshot(user.snapshot(), major, groupId, year);
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

  public Major major() {
    return major;
  }

  public Identifier groupId() {
    return groupId;
  }

  public String year() {
    return year;
  }
}
