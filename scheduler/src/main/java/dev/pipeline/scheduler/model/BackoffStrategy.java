package dev.pipeline.scheduler.model;

public enum BackoffStrategy {
  FIXED,
  EXPONENTIAL
}
