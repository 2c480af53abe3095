package dev.pipeline.scheduler.model;

public enum NotificationChannelType {
  SLACK,
  EMAIL,
  WEBHOOK
}
