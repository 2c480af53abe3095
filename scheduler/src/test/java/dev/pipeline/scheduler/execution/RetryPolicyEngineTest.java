package dev.pipeline.scheduler.execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pipeline.scheduler.model.RetryPolicy;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

class RetryPolicyEngineTest {

  @Test
  public void exponentialBackoffIsCapped() {
    var policy = RetryPolicy.exponential(5, 10, 40);
    assertEquals(10, RetryPolicyEngine.delaySeconds(policy, 1));
    assertEquals(20, RetryPolicyEngine.delaySeconds(policy, 2));
    assertEquals(40, RetryPolicyEngine.delaySeconds(policy, 3));
    assertEquals(40, RetryPolicyEngine.delaySeconds(policy, 4));
  }

  @Test
  public void exponentialWithoutCapDoesNotOverflow() {
    var policy = RetryPolicy.exponential(100, 10, null);
    assertEquals(10L << 9, RetryPolicyEngine.delaySeconds(policy, 10));
    assertEquals(RetryPolicyEngine.MAX_DELAY_SECONDS, RetryPolicyEngine.delaySeconds(policy, 30));
    assertEquals(RetryPolicyEngine.MAX_DELAY_SECONDS, RetryPolicyEngine.delaySeconds(policy, 80));
  }

  @Test
  public void longRetryChainsStayAddableToFinishTime() {
    var finishedAt = Instant.parse("2024-01-01T00:00:00Z");
    var uncapped = RetryPolicy.exponential(1000, 1, null);
    var capped = RetryPolicy.exponential(1000, 1, Integer.MAX_VALUE);
    for (int attempt : new int[] {53, 54, 64, 65, 1000, Integer.MAX_VALUE}) {
      assertEquals(
          finishedAt.plus(Duration.ofDays(365)),
          finishedAt.plus(RetryPolicyEngine.delay(uncapped, attempt)));
      assertEquals(
          finishedAt.plus(Duration.ofDays(365)),
          finishedAt.plus(RetryPolicyEngine.delay(capped, attempt)));
    }
    var fixed = RetryPolicy.fixed(3, Integer.MAX_VALUE);
    assertEquals(RetryPolicyEngine.MAX_DELAY_SECONDS, RetryPolicyEngine.delaySeconds(fixed, 2));
  }

  @Test
  public void fixedBackoff() {
    var policy = RetryPolicy.fixed(3, 10);
    for (int attempt = 1; attempt <= 6; attempt++) {
      assertEquals(10, RetryPolicyEngine.delaySeconds(policy, attempt));
    }
    assertEquals(Duration.ofSeconds(10), RetryPolicyEngine.delay(policy, 2));
  }

  @Test
  public void exhaustion() {
    var policy = RetryPolicy.fixed(2, 10);
    assertEquals(3, RetryPolicyEngine.maxAttempts(policy));
    assertFalse(RetryPolicyEngine.isExhausted(policy, 1));
    assertFalse(RetryPolicyEngine.isExhausted(policy, 3));
    assertTrue(RetryPolicyEngine.isExhausted(policy, 4));

    assertTrue(RetryPolicyEngine.isExhausted(RetryPolicy.none(), 1));
  }

  @Test
  public void negativeValuesRejected() {
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(-1, 10));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.fixed(1, -10));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.exponential(1, 10, -1));
  }
}
