package dev.pipeline.scheduler.exceptions;

/**
 * {@code AttemptConflictException} is thrown when an attempt cannot be recorded because another
 * attempt for the same scheduled run was recorded first. Attempt numbers stay gapless; the losing
 * launch is abandoned.
 */
public class AttemptConflictException extends RuntimeException {
  private final long scheduledRunId;
  private final int attemptNumber;

  public AttemptConflictException(long scheduledRunId, int attemptNumber) {
    super(
        "Attempt %d of scheduled run %d was already recorded"
            .formatted(attemptNumber, scheduledRunId));
    this.scheduledRunId = scheduledRunId;
    this.attemptNumber = attemptNumber;
  }

  public long scheduledRunId() {
    return scheduledRunId;
  }

  public int attemptNumber() {
    return attemptNumber;
  }
}
