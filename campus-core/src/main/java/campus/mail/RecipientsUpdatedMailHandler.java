package campus.mail;

import campus.invitation.RecipientsUpdated;
import campus.processor.EventHandler;
import campus.spi.MailSender;

/** Invites recipients added by an update. Recipients invited before are not mailed again. */
public final class RecipientsUpdatedMailHandler implements EventHandler<RecipientsUpdated> {
  private final InvitationMailer mailer;

  public RecipientsUpdatedMailHandler(MailSender sender, String baseUrl) {
    this.mailer = new InvitationMailer(sender, baseUrl);
  }

  @Override
  public String name() {
    return "staff-invitation-recipients-mailer";
  }

  @Override
  public Class<RecipientsUpdated> eventType() {
    return RecipientsUpdated.class;
  }

  @Override
  public void handle(RecipientsUpdated event) throws Exception {
    mailer.sendAll(event.addedRecipients(), event.code());
  }
}
