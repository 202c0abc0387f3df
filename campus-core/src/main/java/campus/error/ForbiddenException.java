package campus.error;

/** The caller may not perform the operation. */
public final class ForbiddenException extends DomainException {
  public ForbiddenException(String message) {
    super("forbidden", message);
  }
}
