package io.campaign.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstAttemptIsAroundBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10_000);

    long delay = policy.computeDelayMs(1);

    assertTrue(delay >= 50 && delay < 150, "got " + delay);
  }

  @Test
  void delayDoublesPerAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100_000);

    long delay2 = policy.computeDelayMs(2);
    long delay4 = policy.computeDelayMs(4);

    assertTrue(delay2 >= 100 && delay2 < 300, "attempt 2: " + delay2);
    assertTrue(delay4 >= 400 && delay4 < 1200, "attempt 4: " + delay4);
  }

  @Test
  void delayNeverExceedsMax() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    for (int attempt = 1; attempt < 40; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay <= 500, "attempt " + attempt + ": " + delay);
    }
    assertTrue(policy.computeDelayMs(Integer.MAX_VALUE) <= 500);
  }

  @Test
  void largeBaseDoesNotOverflow() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(Long.MAX_VALUE / 4, Long.MAX_VALUE / 2);

    assertTrue(policy.computeDelayMs(30) > 0);
  }

  @Test
  void nonPositiveAttemptsMeanNoDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-3));
  }

  @Test
  void defaultsAreExposed() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(ExponentialBackoffRetryPolicy.DEFAULT_BASE_DELAY_MS, policy.baseDelayMs());
    assertEquals(ExponentialBackoffRetryPolicy.DEFAULT_MAX_DELAY_MS, policy.maxDelayMs());
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(200, 100));
  }
}
