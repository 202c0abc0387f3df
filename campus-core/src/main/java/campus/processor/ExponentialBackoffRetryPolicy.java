package campus.processor;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with equal jitter.
 *
 * <p>The nominal delay is {@code baseDelay * 2^(attempts-1)} capped at {@code maxDelay}.
 * Half of it is fixed and the other half is random, so retries of several subscriptions
 * spread out while never retrying sooner than half the nominal delay.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay) {
    this(baseDelay.toMillis(), maxDelay.toMillis());
  }

  /**
   * @param baseDelayMs delay of the first retry in milliseconds
   * @param maxDelayMs  upper bound in milliseconds, not below {@code baseDelayMs}
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long nominal = nominalDelayMs(attempts);
    long half = nominal / 2;
    return half + ThreadLocalRandom.current().nextLong(nominal - half + 1);
  }

  long nominalDelayMs(int attempts) {
    int exponent = attempts - 1;
    // shifting further would overflow
    if (exponent >= Long.numberOfLeadingZeros(baseDelayMs) - 1) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs << exponent);
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }
}
