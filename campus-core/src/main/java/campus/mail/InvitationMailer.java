package campus.mail;

import campus.spi.MailSender;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends invitation links to a list of recipients. A failed recipient does not stop the
 * others; the first failure is rethrown at the end with the rest suppressed, so the event
 * is delivered again.
 */
final class InvitationMailer {
  private static final Logger logger = Logger.getLogger(InvitationMailer.class.getName());

  private final MailSender sender;
  private final String baseUrl;

  InvitationMailer(MailSender sender, String baseUrl) {
    this.sender = Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(baseUrl, "baseUrl");
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  void sendAll(List<String> recipients, String code) throws Exception {
    Exception failure = null;
    for (String recipient : recipients) {
      try {
        sender.send(Mails.staffInvitation(baseUrl, recipient, code));
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to send staff invitation to " + redact(recipient), e);
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  static String redact(String email) {
    if (email == null) {
      return null;
    }
    int at = email.indexOf('@');
    return at <= 1 ? "***" + email.substring(Math.max(at, 0)) : email.charAt(0) + "***" + email.substring(at);
  }
}
