package dev.pipeline.scheduler.model;

public enum ScheduleStatus {
  ACTIVE,
  PAUSED
}
