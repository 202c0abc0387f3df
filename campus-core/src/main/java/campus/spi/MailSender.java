package campus.spi;

/**
 * Mail delivery. Invoked only by event handlers, never by aggregates.
 */
public interface MailSender {

  /**
   * @throws Exception if delivery failed; the triggering event is retried
   */
  void send(Mail mail) throws Exception;
}
