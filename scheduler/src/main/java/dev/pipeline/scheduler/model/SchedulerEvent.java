package dev.pipeline.scheduler.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** An append-only audit record of a scheduler state transition. */
public record SchedulerEvent(
    Long id,
    Long scheduleId,
    Long scheduledRunId,
    EventLevel level,
    String eventType,
    String message,
    Map<String, Object> details,
    Instant timestamp) {

  public SchedulerEvent {
    Objects.requireNonNull(level, "SchedulerEvent level must not be null");
    Objects.requireNonNull(eventType, "SchedulerEvent eventType must not be null");
    details =
        details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public static SchedulerEvent of(
      Long scheduleId,
      Long scheduledRunId,
      EventLevel level,
      String eventType,
      String message,
      Map<String, Object> details,
      Instant timestamp) {
    return new SchedulerEvent(
        null, scheduleId, scheduledRunId, level, eventType, message, details, timestamp);
  }
}
