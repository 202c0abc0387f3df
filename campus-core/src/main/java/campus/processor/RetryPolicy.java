package campus.processor;

/**
 * Delay before a subscription retries an event whose handler failed.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * @param attempts consecutive failures so far, starting at 1
   * @return delay in milliseconds, never negative
   */
  long computeDelayMs(int attempts);
}
