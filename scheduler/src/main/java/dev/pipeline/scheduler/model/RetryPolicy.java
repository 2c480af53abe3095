package dev.pipeline.scheduler.model;

/**
 * How a failed attempt of a scheduled run is retried.
 *
 * @param maxRetries number of retries after the first attempt; 0 disables retries
 * @param delaySeconds base delay before a retry
 * @param backoffStrategy FIXED keeps the base delay, EXPONENTIAL doubles it per attempt
 * @param maxDelaySeconds optional cap applied to the exponential delay
 */
public record RetryPolicy(
    int maxRetries, int delaySeconds, BackoffStrategy backoffStrategy, Integer maxDelaySeconds) {

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("RetryPolicy.maxRetries must not be negative");
    }
    if (delaySeconds < 0) {
      throw new IllegalArgumentException("RetryPolicy.delaySeconds must not be negative");
    }
    if (maxDelaySeconds != null && maxDelaySeconds < 0) {
      throw new IllegalArgumentException("RetryPolicy.maxDelaySeconds must not be negative");
    }
    if (backoffStrategy == null) {
      backoffStrategy = BackoffStrategy.FIXED;
    }
  }

  /** No retries, 60 second fixed delay should retries be enabled later */
  public static RetryPolicy none() {
    return new RetryPolicy(0, 60, BackoffStrategy.FIXED, null);
  }

  public static RetryPolicy fixed(int maxRetries, int delaySeconds) {
    return new RetryPolicy(maxRetries, delaySeconds, BackoffStrategy.FIXED, null);
  }

  public static RetryPolicy exponential(int maxRetries, int delaySeconds, Integer maxDelaySeconds) {
    return new RetryPolicy(maxRetries, delaySeconds, BackoffStrategy.EXPONENTIAL, maxDelaySeconds);
  }

  public RetryPolicy withMaxRetries(int maxRetries) {
    return new RetryPolicy(maxRetries, delaySeconds, backoffStrategy, maxDelaySeconds);
  }
}
