package campus.app;

import campus.error.AlreadyExistsException;
import campus.processor.EventHandler;
import campus.processor.UnknownEventException;
import campus.registration.RegistrationCompleted;
import campus.user.Role;
import campus.user.Staff;
import campus.user.StaffRepository;
import campus.user.Student;
import campus.user.StudentRepository;
import campus.user.User;
import campus.user.UserRepository;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Creates the student or staff account of a completed registration.
 *
 * <p>Delivery is at-least-once: an email that already belongs to a user means the event
 * was handled before, and it is acknowledged without creating anything. A barcode held by
 * another user cannot be resolved by retrying, so that event is acknowledged as skipped.
 */
public final class RegistrationCompletedHandler implements EventHandler<RegistrationCompleted> {
  private static final Logger logger = Logger.getLogger(RegistrationCompletedHandler.class.getName());

  public static final String GROUP = "registration-completed-projector";

  private final UserRepository users;
  private final StudentRepository students;
  private final StaffRepository staff;
  private final Clock clock;

  public RegistrationCompletedHandler(
      UserRepository users,
      StudentRepository students,
      StaffRepository staff,
      Clock clock) {
    this.users = Objects.requireNonNull(users, "users");
    this.students = Objects.requireNonNull(students, "students");
    this.staff = Objects.requireNonNull(staff, "staff");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String name() {
    return GROUP;
  }

  @Override
  public Class<RegistrationCompleted> eventType() {
    return RegistrationCompleted.class;
  }

  @Override
  public void handle(RegistrationCompleted event) {
    if (users.existsByEmail(event.email())) {
      logger.fine("User for registration " + event.registrationId() + " already exists");
      return;
    }

    User.Details details = new User.Details(
        event.barcode(), event.email(), event.firstName(), event.lastName(), event.passwordHash());
    try {
      if (event.role() == Role.STUDENT) {
        students.save(Student.register(details, event.major(), event.groupId(), event.year(),
            event.registrationId(), clock));
      } else if (event.role() == Role.STAFF) {
        staff.save(Staff.register(details, event.registrationId(), clock));
      } else {
        throw new UnknownEventException("Unsupported role " + event.role() + " in registration "
            + event.registrationId());
      }
    } catch (AlreadyExistsException e) {
      if (users.existsByEmail(event.email())) {
        logger.fine("User for registration " + event.registrationId() + " was created concurrently");
        return;
      }
      if (users.existsByBarcode(event.barcode())) {
        // a retry cannot succeed and would hold back the rest of the stream
        logger.warning("Barcode " + event.barcode() + " of registration " + event.registrationId()
            + " belongs to another user; no account created");
        throw new UnknownEventException("Barcode taken for registration " + event.registrationId());
      }
      throw e;
    }
  }
}
