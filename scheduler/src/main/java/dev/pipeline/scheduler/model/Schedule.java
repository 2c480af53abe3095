package dev.pipeline.scheduler.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A recurring job definition. {@code nextRunTime} is recomputed on create, on cron or timezone
 * change, on resume and after every firing; a paused schedule keeps it frozen.
 */
public record Schedule(
    Long id,
    String name,
    String description,
    String cronExpression,
    String timezone,
    String command,
    long environmentId,
    NotificationConfig notificationConfig,
    RetryPolicy retryPolicy,
    RetentionPolicy retentionPolicy,
    CatchUpPolicy catchUpPolicy,
    OverlapPolicy overlapPolicy,
    boolean enabled,
    ScheduleStatus status,
    Instant nextRunTime,
    Instant lastRunTime,
    Instant createdAt,
    Instant updatedAt,
    String createdBy,
    String updatedBy) {

  public Schedule {
    Objects.requireNonNull(name, "Schedule name must not be null");
    Objects.requireNonNull(cronExpression, "Schedule cronExpression must not be null");
    Objects.requireNonNull(command, "Schedule command must not be null");
    if (command.isBlank()) {
      throw new IllegalArgumentException("Schedule command must not be empty");
    }
    if (notificationConfig == null) {
      notificationConfig = NotificationConfig.empty();
    }
    if (retryPolicy == null) {
      retryPolicy = RetryPolicy.none();
    }
    if (catchUpPolicy == null) {
      catchUpPolicy = CatchUpPolicy.SKIP;
    }
    if (overlapPolicy == null) {
      overlapPolicy = OverlapPolicy.NO_OVERLAP;
    }
    if (status == null) {
      status = enabled ? ScheduleStatus.ACTIVE : ScheduleStatus.PAUSED;
    }
  }

  /** An enabled schedule with default policies, not yet stored */
  public Schedule(
      String name, String cronExpression, String timezone, String command, long environmentId) {
    this(
        null,
        name,
        null,
        cronExpression,
        timezone,
        command,
        environmentId,
        NotificationConfig.empty(),
        RetryPolicy.none(),
        null,
        CatchUpPolicy.SKIP,
        OverlapPolicy.NO_OVERLAP,
        true,
        ScheduleStatus.ACTIVE,
        null,
        null,
        null,
        null,
        null,
        null);
  }

  public Schedule withId(Long id) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withName(String name) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withDescription(String description) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withCronExpression(String cronExpression) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withTimezone(String timezone) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withCommand(String command) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withEnvironmentId(long environmentId) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withNotificationConfig(NotificationConfig notificationConfig) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withRetryPolicy(RetryPolicy retryPolicy) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withRetentionPolicy(RetentionPolicy retentionPolicy) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withCatchUpPolicy(CatchUpPolicy catchUpPolicy) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withOverlapPolicy(OverlapPolicy overlapPolicy) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withNextRunTime(Instant nextRunTime) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withLastRunTime(Instant lastRunTime) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withCreatedBy(String createdBy) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withUpdatedBy(String updatedBy) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  /** Enabling makes the schedule ACTIVE, disabling makes it PAUSED. */
  public Schedule withEnabled(boolean enabled) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        enabled ? ScheduleStatus.ACTIVE : ScheduleStatus.PAUSED,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }

  public Schedule withTimestamps(Instant createdAt, Instant updatedAt) {
    return new Schedule(
        id,
        name,
        description,
        cronExpression,
        timezone,
        command,
        environmentId,
        notificationConfig,
        retryPolicy,
        retentionPolicy,
        catchUpPolicy,
        overlapPolicy,
        enabled,
        status,
        nextRunTime,
        lastRunTime,
        createdAt,
        updatedAt,
        createdBy,
        updatedBy);
  }
}
