package campus.processor;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void nominalDelayDoublesUntilCapped() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 1000);

    assertEquals(100, policy.nominalDelayMs(1));
    assertEquals(200, policy.nominalDelayMs(2));
    assertEquals(800, policy.nominalDelayMs(4));
    assertEquals(1000, policy.nominalDelayMs(5));
  }

  @Test
  void jitteredDelayStaysWithinHalfAndNominal() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100_000);

    for (int i = 0; i < 200; i++) {
      long delay = policy.computeDelayMs(3);
      assertTrue(delay >= 200 && delay <= 400, "delay out of range: " + delay);
    }
  }

  @Test
  void largeAttemptCountDoesNotOverflow() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(Duration.ofMillis(200), Duration.ofMinutes(1));

    assertEquals(60_000, policy.nominalDelayMs(Integer.MAX_VALUE));
    long delay = policy.computeDelayMs(10_000);
    assertTrue(delay >= 30_000 && delay <= 60_000, "delay out of range: " + delay);
  }

  @Test
  void noAttemptsNoDelay() {
    assertEquals(0, new ExponentialBackoffRetryPolicy(100, 1000).computeDelayMs(0));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(500, 100));
  }
}
