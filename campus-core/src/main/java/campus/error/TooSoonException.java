package campus.error;

import java.time.Duration;

/** An operation was retried before its cooldown elapsed. */
public final class TooSoonException extends DomainException {
  private final Duration retryAfter;

  public TooSoonException(Duration retryAfter) {
    super("too_soon", "retry allowed in " + retryAfter.toSeconds() + "s");
    this.retryAfter = retryAfter;
  }

  public Duration retryAfter() {
    return retryAfter;
  }
}
