package dev.pipeline.scheduler.model;

/** Result of sending a test notification over one channel. */
public record NotificationTestResult(
    NotificationChannelType channel, boolean success, String errorMessage) {}
