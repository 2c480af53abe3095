package dev.pipeline.scheduler.exceptions;

public class NonExistentRunException extends RuntimeException {
  private final long scheduledRunId;

  public NonExistentRunException(long scheduledRunId) {
    super("Scheduled run %d does not exist".formatted(scheduledRunId));
    this.scheduledRunId = scheduledRunId;
  }

  public long scheduledRunId() {
    return scheduledRunId;
  }
}
