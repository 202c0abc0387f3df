package campus.error;

/**
 * Base class of business errors raised by aggregates, repositories and services.
 *
 * <p>Each subclass has a stable {@link #code()} that outer layers can map to a response
 * without parsing messages.
 *
 * <h2>Persistable errors</h2>
 * A {@linkplain #persistable() persistable} error reports a rejected request whose side
 * effects must still be committed, for example a wrong verification code that increments
 * the attempt counter. {@link campus.spi.Repository#update} commits the aggregate state and
 * its recorded events, then rethrows the error to the caller.
 */
public abstract class DomainException extends RuntimeException {
  private final String code;
  private final boolean persistable;

  protected DomainException(String code, String message) {
    this(code, message, false);
  }

  protected DomainException(String code, String message, boolean persistable) {
    super(message);
    this.code = code;
    this.persistable = persistable;
  }

  protected DomainException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.persistable = false;
  }

  public String code() {
    return code;
  }

  public boolean persistable() {
    return persistable;
  }
}
