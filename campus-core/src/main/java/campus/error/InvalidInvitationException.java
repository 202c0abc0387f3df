package campus.error;

/** The email/code pair does not grant access to the invitation. */
public final class InvalidInvitationException extends DomainException {
  public InvalidInvitationException() {
    super("invalid_invitation", "invalid invitation");
  }
}
