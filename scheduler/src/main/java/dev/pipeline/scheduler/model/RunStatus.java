package dev.pipeline.scheduler.model;

/**
 * Outcome of a scheduled run. {@code SKIPPED} is also the status of a run whose current attempt
 * has not finished yet.
 */
public enum RunStatus {
  SUCCESS,
  FAILURE,
  CANCELLED,
  SKIPPED
}
