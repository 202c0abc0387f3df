package campus.mail;

import campus.processor.EventHandler;
import campus.spi.MailSender;
import campus.user.StudentRegistered;

import java.util.Objects;

public final class StudentWelcomeMailHandler implements EventHandler<StudentRegistered> {
  private final MailSender sender;

  public StudentWelcomeMailHandler(MailSender sender) {
    this.sender = Objects.requireNonNull(sender, "sender");
  }

  @Override
  public String name() {
    return "student-welcome-mailer";
  }

  @Override
  public Class<StudentRegistered> eventType() {
    return StudentRegistered.class;
  }

  @Override
  public void handle(StudentRegistered event) throws Exception {
    sender.send(Mails.welcome(event.email(), event.firstName(), event.lastName()));
  }
}
