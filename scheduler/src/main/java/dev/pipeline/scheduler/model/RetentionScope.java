package dev.pipeline.scheduler.model;

public enum RetentionScope {
  PER_SCHEDULE,
  PER_ENVIRONMENT
}
