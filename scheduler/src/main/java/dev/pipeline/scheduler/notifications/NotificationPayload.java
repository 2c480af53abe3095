package dev.pipeline.scheduler.notifications;

import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduledRun;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builds the body sent to notification channels. Keys are snake_case. */
public final class NotificationPayload {

  private NotificationPayload() {}

  public static Map<String, Object> forRun(
      NotificationTrigger trigger, Schedule schedule, ScheduledRun run, Attempt latestAttempt) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("trigger", trigger.label());
    payload.put("run_id", run.id());
    payload.put("job_handle", latestAttempt == null ? null : latestAttempt.jobHandle());
    payload.put("schedule_id", schedule.id());
    payload.put("schedule_name", schedule.name());
    payload.put("status", run.status().name());
    payload.put("retry_status", run.retryStatus().name());
    payload.put("attempt_number", latestAttempt == null ? 0 : latestAttempt.attemptNumber());
    payload.put("triggering_event", run.triggeringEvent().name());
    payload.put("scheduled_at", text(run.scheduledAt()));
    payload.put("queued_at", text(run.queuedAt()));
    payload.put("started_at", text(run.startedAt()));
    payload.put("finished_at", text(run.finishedAt()));
    payload.put("error_message", latestAttempt == null ? null : latestAttempt.errorMessage());
    payload.put("environment", run.environmentSnapshot());
    payload.put("command", run.command());
    payload.put("log_links", run.logLinks());
    payload.put("artifact_links", run.artifactLinks());
    return payload;
  }

  /** A payload marked as a test, sent by a notification test request */
  public static Map<String, Object> forTest(String scheduleName, Instant now) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("trigger", "test");
    payload.put("test", true);
    payload.put("schedule_name", scheduleName);
    payload.put("status", "TEST");
    payload.put("sent_at", text(now));
    payload.put("log_links", Map.of());
    payload.put("artifact_links", Map.of());
    return payload;
  }

  /** One-line human readable summary used by Slack messages and email subjects */
  public static String summary(Map<String, Object> payload) {
    if (Boolean.TRUE.equals(payload.get("test"))) {
      return "Test notification for schedule '%s'".formatted(payload.get("schedule_name"));
    }
    return "Run %s of schedule '%s': %s (%s, attempt %s)"
        .formatted(
            payload.get("run_id"),
            payload.get("schedule_name"),
            payload.get("trigger"),
            payload.get("status"),
            payload.get("attempt_number"));
  }

  private static String text(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
