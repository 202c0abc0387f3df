package campus.app;

import campus.event.EventTypeRegistry;
import campus.invitation.RecipientsUpdated;
import campus.invitation.StaffInvitation;
import campus.invitation.StaffInvitationCreated;
import campus.invitation.StaffInvitationDeleted;
import campus.invitation.ValidityUpdated;
import campus.registration.Registration;
import campus.registration.RegistrationCodeResent;
import campus.registration.RegistrationCompleted;
import campus.registration.RegistrationFailed;
import campus.registration.RegistrationStarted;
import campus.registration.RegistrationVerified;
import campus.user.Staff;
import campus.user.StaffInvitationAccepted;
import campus.user.StaffRegistered;
import campus.user.Student;
import campus.user.StudentRegistered;
import campus.user.User;
import campus.user.UserAvatarUpdated;
import campus.user.UserProfileUpdated;
import campus.user.UserRoleAssigned;

/**
 * Catalog of every event this library publishes.
 */
public final class CampusEvents {

  private CampusEvents() {
  }

  public static EventTypeRegistry registry() {
    return new EventTypeRegistry()
        .register(RegistrationStarted.class, Registration.EVENT_STREAM)
        .register(RegistrationVerified.class, Registration.EVENT_STREAM)
        .register(RegistrationFailed.class, Registration.EVENT_STREAM)
        .register(RegistrationCodeResent.class, Registration.EVENT_STREAM)
        .register(RegistrationCompleted.class, Registration.EVENT_STREAM)
        .register(StaffInvitationCreated.class, StaffInvitation.EVENT_STREAM)
        .register(RecipientsUpdated.class, StaffInvitation.EVENT_STREAM)
        .register(ValidityUpdated.class, StaffInvitation.EVENT_STREAM)
        .register(StaffInvitationDeleted.class, StaffInvitation.EVENT_STREAM)
        .register(UserProfileUpdated.class, User.EVENT_STREAM)
        .register(UserRoleAssigned.class, User.EVENT_STREAM)
        .register(UserAvatarUpdated.class, User.EVENT_STREAM)
        .register(StudentRegistered.class, Student.EVENT_STREAM)
        .register(StaffRegistered.class, Staff.EVENT_STREAM)
        .register(StaffInvitationAccepted.class, Staff.EVENT_STREAM);
  }
}
