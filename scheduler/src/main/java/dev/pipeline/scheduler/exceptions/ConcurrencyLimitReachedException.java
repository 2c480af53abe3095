package dev.pipeline.scheduler.exceptions;

/**
 * {@code ConcurrencyLimitReachedException} is thrown by a job executor that has no free execution
 * slot. No job was started; the caller may try again later.
 */
public class ConcurrencyLimitReachedException extends RuntimeException {
  private final int limit;

  public ConcurrencyLimitReachedException(int limit) {
    super("Maximum of %d concurrent jobs reached".formatted(limit));
    this.limit = limit;
  }

  /** The executor's concurrency limit at the time of the rejected start */
  public int limit() {
    return limit;
  }
}
