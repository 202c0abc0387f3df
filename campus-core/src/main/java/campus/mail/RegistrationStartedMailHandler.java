package campus.mail;

import campus.processor.EventHandler;
import campus.registration.RegistrationStarted;
import campus.spi.MailSender;

import java.util.Objects;

/** Sends the first verification code. */
public final class RegistrationStartedMailHandler implements EventHandler<RegistrationStarted> {
  private final MailSender sender;

  public RegistrationStartedMailHandler(MailSender sender) {
    this.sender = Objects.requireNonNull(sender, "sender");
  }

  @Override
  public String name() {
    return "registration-started-mailer";
  }

  @Override
  public Class<RegistrationStarted> eventType() {
    return RegistrationStarted.class;
  }

  @Override
  public void handle(RegistrationStarted event) throws Exception {
    sender.send(Mails.verificationCode(event.email(), event.verificationCode()));
  }
}
