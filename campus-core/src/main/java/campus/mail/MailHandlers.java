package campus.mail;

import campus.processor.HandlerGroup;
import campus.processor.HandlerRegistry;
import campus.spi.MailSender;

/**
 * Registers the mail handlers as two consumer groups, one per source stream, plus the
 * welcome mail on the student stream.
 */
public final class MailHandlers {
  public static final String REGISTRATION_GROUP = "registration-mailer";
  public static final String INVITATION_GROUP = "staff-invitation-mailer";

  private MailHandlers() {
  }

  public static HandlerGroup registration(MailSender sender) {
    return HandlerGroup.of(REGISTRATION_GROUP,
        new RegistrationStartedMailHandler(sender),
        new CodeResentMailHandler(sender));
  }

  public static HandlerGroup invitation(MailSender sender, String invitationBaseUrl) {
    return HandlerGroup.of(INVITATION_GROUP,
        new InvitationCreatedMailHandler(sender, invitationBaseUrl),
        new RecipientsUpdatedMailHandler(sender, invitationBaseUrl));
  }

  public static HandlerRegistry registerAll(HandlerRegistry registry, MailSender sender, String invitationBaseUrl) {
    return registry
        .register(registration(sender))
        .register(invitation(sender, invitationBaseUrl))
        .register(new StudentWelcomeMailHandler(sender));
  }
}
