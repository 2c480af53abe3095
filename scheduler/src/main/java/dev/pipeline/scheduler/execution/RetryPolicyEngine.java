package dev.pipeline.scheduler.execution;

import dev.pipeline.scheduler.model.RetryPolicy;

import java.time.Duration;

/** Backoff and exhaustion rules of a {@link RetryPolicy}. */
public final class RetryPolicyEngine {

  /** Longest wait before a retry, whatever the policy: 365 days */
  public static final long MAX_DELAY_SECONDS = 365L * 24 * 60 * 60;

  private RetryPolicyEngine() {}

  /**
   * Seconds to wait before starting attempt {@code attemptNumber}. FIXED always waits the base
   * delay; EXPONENTIAL doubles it for every attempt after the first, up to the policy's cap. No
   * delay exceeds {@link #MAX_DELAY_SECONDS}, so it can always be added to a finish time.
   */
  public static long delaySeconds(RetryPolicy policy, int attemptNumber) {
    long base = policy.delaySeconds();
    switch (policy.backoffStrategy()) {
      case EXPONENTIAL:
        int exponent = Math.max(attemptNumber, 1) - 1;
        long delay;
        if (base == 0) {
          delay = 0;
        } else if (exponent >= Long.numberOfLeadingZeros(base) - 1) {
          delay = MAX_DELAY_SECONDS;
        } else {
          delay = Math.min(base << exponent, MAX_DELAY_SECONDS);
        }
        if (policy.maxDelaySeconds() != null) {
          delay = Math.min(delay, policy.maxDelaySeconds());
        }
        return delay;
      case FIXED:
      default:
        return Math.min(base, MAX_DELAY_SECONDS);
    }
  }

  public static Duration delay(RetryPolicy policy, int attemptNumber) {
    return Duration.ofSeconds(delaySeconds(policy, attemptNumber));
  }

  /** True when no retries are configured or more attempts ran than the policy allows. */
  public static boolean isExhausted(RetryPolicy policy, int attemptsTotal) {
    return policy.maxRetries() <= 0 || attemptsTotal > policy.maxRetries() + 1;
  }

  /** The first attempt plus every retry */
  public static int maxAttempts(RetryPolicy policy) {
    return policy.maxRetries() + 1;
  }
}
