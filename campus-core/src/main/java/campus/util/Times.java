package campus.util;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Instants at the precision every supported database keeps (microseconds), so values
 * survive a store/load round trip unchanged.
 */
public final class Times {

  private Times() {
  }

  public static Instant now(Clock clock) {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }
}
