package dev.pipeline.scheduler.model;

/** Status of a single attempt, as reported by the job executor. */
public enum AttemptStatus {
  QUEUED,
  RUNNING,
  SUCCEEDED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED || this == CANCELLED;
  }
}
