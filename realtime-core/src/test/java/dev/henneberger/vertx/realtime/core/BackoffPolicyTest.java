package dev.henneberger.vertx.realtime.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

  @Test
  void growsExponentiallyUpToMaxDelay() {
    BackoffPolicy policy = BackoffPolicy.exponential()
      .setInitialDelay(Duration.ofMillis(100))
      .setMaxDelay(Duration.ofMillis(1_000))
      .setMultiplier(2.0d)
      .setJitter(0.0d);

    assertEquals(100L, policy.delayMillis(1));
    assertEquals(200L, policy.delayMillis(2));
    assertEquals(800L, policy.delayMillis(4));
    assertEquals(1_000L, policy.delayMillis(10));
  }

  @Test
  void jitterStaysWithinSpread() {
    BackoffPolicy policy = BackoffPolicy.exponential()
      .setInitialDelay(Duration.ofMillis(1_000))
      .setJitter(0.2d);

    for (int i = 0; i < 100; i++) {
      long delay = policy.delayMillis(1);
      assertTrue(delay >= 800L && delay <= 1_200L, "delay " + delay);
    }
  }

  @Test
  void zeroMaxAttemptsRetriesForever() {
    assertTrue(BackoffPolicy.exponential().shouldReconnect(1_000_000L));

    BackoffPolicy bounded = BackoffPolicy.exponential().setMaxAttempts(3);
    assertTrue(bounded.shouldReconnect(2));
    assertFalse(bounded.shouldReconnect(3));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.exponential().setJitter(1.5d));
    assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.exponential()
      .setInitialDelay(Duration.ofSeconds(10))
      .setMaxDelay(Duration.ofSeconds(1))
      .validate());
    assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.exponential().setMaxAttempts(-1).validate());
  }
}
