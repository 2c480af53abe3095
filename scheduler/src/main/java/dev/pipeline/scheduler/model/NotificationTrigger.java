package dev.pipeline.scheduler.model;

public enum NotificationTrigger {
  RUN_STARTED,
  RUN_SUCCEEDED,
  RUN_FAILED,
  RUN_CANCELLED;

  /** Lower-case form used in notification texts, e.g. {@code run_failed} */
  public String label() {
    return name().toLowerCase();
  }
}
