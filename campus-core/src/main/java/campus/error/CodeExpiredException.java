package campus.error;

/** The verification code is past its expiry, whatever its value. */
public final class CodeExpiredException extends DomainException {
  public CodeExpiredException() {
    super("code_expired", "verification code expired");
  }
}
