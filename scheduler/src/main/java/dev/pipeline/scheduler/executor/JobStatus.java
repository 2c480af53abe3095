package dev.pipeline.scheduler.executor;

import dev.pipeline.scheduler.model.AttemptStatus;

import java.time.Instant;
import java.util.Objects;

public record JobStatus(
    AttemptStatus status, Instant startedAt, Instant finishedAt, String errorMessage) {

  public JobStatus {
    Objects.requireNonNull(status, "JobStatus status must not be null");
  }

  public static JobStatus queued() {
    return new JobStatus(AttemptStatus.QUEUED, null, null, null);
  }

  public static JobStatus running(Instant startedAt) {
    return new JobStatus(AttemptStatus.RUNNING, startedAt, null, null);
  }

  public static JobStatus succeeded(Instant startedAt, Instant finishedAt) {
    return new JobStatus(AttemptStatus.SUCCEEDED, startedAt, finishedAt, null);
  }

  public static JobStatus failed(Instant startedAt, Instant finishedAt, String errorMessage) {
    return new JobStatus(AttemptStatus.FAILED, startedAt, finishedAt, errorMessage);
  }

  public static JobStatus cancelled(Instant startedAt, Instant finishedAt) {
    return new JobStatus(AttemptStatus.CANCELLED, startedAt, finishedAt, null);
  }
}
