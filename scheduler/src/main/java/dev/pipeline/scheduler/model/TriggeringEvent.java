package dev.pipeline.scheduler.model;

public enum TriggeringEvent {
  CRON,
  MANUAL
}
