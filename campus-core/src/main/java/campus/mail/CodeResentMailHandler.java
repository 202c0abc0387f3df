package campus.mail;

import campus.processor.EventHandler;
import campus.registration.RegistrationCodeResent;
import campus.spi.MailSender;

import java.util.Objects;

/** Sends a replacement verification code. */
public final class CodeResentMailHandler implements EventHandler<RegistrationCodeResent> {
  private final MailSender sender;

  public CodeResentMailHandler(MailSender sender) {
    this.sender = Objects.requireNonNull(sender, "sender");
  }

  @Override
  public String name() {
    return "registration-code-resent-mailer";
  }

  @Override
  public Class<RegistrationCodeResent> eventType() {
    return RegistrationCodeResent.class;
  }

  @Override
  public void handle(RegistrationCodeResent event) throws Exception {
    sender.send(Mails.verificationCode(event.email(), event.verificationCode()));
  }
}
