package dev.pipeline.scheduler.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One execution try of a scheduled run against the job executor. Attempt numbers start at 1 and
 * have no gaps within a run.
 */
public record Attempt(
    Long id,
    long scheduledRunId,
    int attemptNumber,
    String jobHandle,
    AttemptStatus status,
    Instant queuedAt,
    Instant startedAt,
    Instant finishedAt,
    String errorMessage) {

  public Attempt {
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("Attempt.attemptNumber must be at least 1");
    }
    if (status == null) {
      status = AttemptStatus.QUEUED;
    }
  }

  @JsonIgnore
  public boolean isTerminal() {
    return status.isTerminal();
  }

  public Attempt withId(Long id) {
    return new Attempt(
        id,
        scheduledRunId,
        attemptNumber,
        jobHandle,
        status,
        queuedAt,
        startedAt,
        finishedAt,
        errorMessage);
  }

  public Attempt withStatus(AttemptStatus status) {
    return new Attempt(
        id,
        scheduledRunId,
        attemptNumber,
        jobHandle,
        status,
        queuedAt,
        startedAt,
        finishedAt,
        errorMessage);
  }

  public Attempt withStartedAt(Instant startedAt) {
    return new Attempt(
        id,
        scheduledRunId,
        attemptNumber,
        jobHandle,
        status,
        queuedAt,
        startedAt,
        finishedAt,
        errorMessage);
  }

  public Attempt withFinishedAt(Instant finishedAt) {
    return new Attempt(
        id,
        scheduledRunId,
        attemptNumber,
        jobHandle,
        status,
        queuedAt,
        startedAt,
        finishedAt,
        errorMessage);
  }

  public Attempt withErrorMessage(String errorMessage) {
    return new Attempt(
        id,
        scheduledRunId,
        attemptNumber,
        jobHandle,
        status,
        queuedAt,
        startedAt,
        finishedAt,
        errorMessage);
  }
}
