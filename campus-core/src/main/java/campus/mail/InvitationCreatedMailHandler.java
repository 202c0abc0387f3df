package campus.mail;

import campus.invitation.StaffInvitationCreated;
import campus.processor.EventHandler;
import campus.spi.MailSender;

/** Invites every initial recipient. */
public final class InvitationCreatedMailHandler implements EventHandler<StaffInvitationCreated> {
  private final InvitationMailer mailer;

  /**
   * @param baseUrl URL of the page accepting invitations, e.g. {@code https://campus.example/staff/invitations}
   */
  public InvitationCreatedMailHandler(MailSender sender, String baseUrl) {
    this.mailer = new InvitationMailer(sender, baseUrl);
  }

  @Override
  public String name() {
    return "staff-invitation-created-mailer";
  }

  @Override
  public Class<StaffInvitationCreated> eventType() {
    return StaffInvitationCreated.class;
  }

  @Override
  public void handle(StaffInvitationCreated event) throws Exception {
    mailer.sendAll(event.recipients(), event.code());
  }
}
