package dev.pipeline.scheduler.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One firing of a schedule, either a cron tick or a manual trigger. Its status and retry status are
 * derived from its attempts; see {@code RunStateMachine}.
 *
 * <p>A run is terminal when its status is SUCCESS or CANCELLED, or FAILURE with no retry in
 * progress. Any other run, including a freshly created one still carrying SKIPPED, is active.
 */
public record ScheduledRun(
    Long id,
    long scheduleId,
    TriggeringEvent triggeringEvent,
    RunStatus status,
    RetryStatus retryStatus,
    int attemptsTotal,
    Instant scheduledAt,
    Instant queuedAt,
    Instant startedAt,
    Instant finishedAt,
    Map<String, Object> environmentSnapshot,
    String command,
    Map<String, String> logLinks,
    Map<String, String> artifactLinks) {

  public ScheduledRun {
    Objects.requireNonNull(triggeringEvent, "ScheduledRun triggeringEvent must not be null");
    if (status == null) {
      status = RunStatus.SKIPPED;
    }
    if (retryStatus == null) {
      retryStatus = RetryStatus.NOT_APPLICABLE;
    }
    environmentSnapshot =
        environmentSnapshot == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(environmentSnapshot));
    logLinks = logLinks == null ? Map.of() : Map.copyOf(logLinks);
    artifactLinks = artifactLinks == null ? Map.of() : Map.copyOf(artifactLinks);
  }

  /** A new run that has not launched any attempt yet */
  public static ScheduledRun pending(
      long scheduleId,
      TriggeringEvent triggeringEvent,
      Instant scheduledAt,
      Map<String, Object> environmentSnapshot,
      String command) {
    return new ScheduledRun(
        null,
        scheduleId,
        triggeringEvent,
        RunStatus.SKIPPED,
        RetryStatus.NOT_APPLICABLE,
        0,
        scheduledAt,
        null,
        null,
        null,
        environmentSnapshot,
        command,
        Map.of(),
        Map.of());
  }

  @JsonIgnore
  public boolean isTerminal() {
    switch (status) {
      case SUCCESS:
      case CANCELLED:
        return true;
      case FAILURE:
        return retryStatus != RetryStatus.IN_PROGRESS;
      default:
        return false;
    }
  }

  @JsonIgnore
  public boolean isActive() {
    return !isTerminal();
  }

  public ScheduledRun withId(Long id) {
    return new ScheduledRun(
        id,
        scheduleId,
        triggeringEvent,
        status,
        retryStatus,
        attemptsTotal,
        scheduledAt,
        queuedAt,
        startedAt,
        finishedAt,
        environmentSnapshot,
        command,
        logLinks,
        artifactLinks);
  }

  public ScheduledRun withStatus(RunStatus status) {
    return new ScheduledRun(
        id,
        scheduleId,
        triggeringEvent,
        status,
        retryStatus,
        attemptsTotal,
        scheduledAt,
        queuedAt,
        startedAt,
        finishedAt,
        environmentSnapshot,
        command,
        logLinks,
        artifactLinks);
  }

  public ScheduledRun withRetryStatus(RetryStatus retryStatus) {
    return new ScheduledRun(
        id,
        scheduleId,
        triggeringEvent,
        status,
        retryStatus,
        attemptsTotal,
        scheduledAt,
        queuedAt,
        startedAt,
        finishedAt,
        environmentSnapshot,
        command,
        logLinks,
        artifactLinks);
  }

  public ScheduledRun withAttemptsTotal(int attemptsTotal) {
    return new ScheduledRun(
        id,
        scheduleId,
        triggeringEvent,
        status,
        retryStatus,
        attemptsTotal,
        scheduledAt,
        queuedAt,
        startedAt,
        finishedAt,
        environmentSnapshot,
        command,
        logLinks,
        artifactLinks);
  }

  public ScheduledRun withQueuedAt(Instant queuedAt) {
    return new ScheduledRun(
        id,
        scheduleId,
        triggeringEvent,
        status,
        retryStatus,
        attemptsTotal,
        scheduledAt,
        queuedAt,
        startedAt,
        finishedAt,
        environmentSnapshot,
        command,
        logLinks,
        artifactLinks);
  }

  public ScheduledRun withStartedAt(Instant startedAt) {
    return new ScheduledRun(
        id,
        scheduleId,
        triggeringEvent,
        status,
        retryStatus,
        attemptsTotal,
        scheduledAt,
        queuedAt,
        startedAt,
        finishedAt,
        environmentSnapshot,
        command,
        logLinks,
        artifactLinks);
  }

  public ScheduledRun withFinishedAt(Instant finishedAt) {
    return new ScheduledRun(
        id,
        scheduleId,
        triggeringEvent,
        status,
        retryStatus,
        attemptsTotal,
        scheduledAt,
        queuedAt,
        startedAt,
        finishedAt,
        environmentSnapshot,
        command,
        logLinks,
        artifactLinks);
  }

  public ScheduledRun withLinks(Map<String, String> logLinks, Map<String, String> artifactLinks) {
    return new ScheduledRun(
        id,
        scheduleId,
        triggeringEvent,
        status,
        retryStatus,
        attemptsTotal,
        scheduledAt,
        queuedAt,
        startedAt,
        finishedAt,
        environmentSnapshot,
        command,
        logLinks,
        artifactLinks);
  }
}
