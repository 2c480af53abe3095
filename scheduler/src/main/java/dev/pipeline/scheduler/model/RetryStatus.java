package dev.pipeline.scheduler.model;

public enum RetryStatus {
  NOT_APPLICABLE,
  IN_PROGRESS,
  EXHAUSTED
}
