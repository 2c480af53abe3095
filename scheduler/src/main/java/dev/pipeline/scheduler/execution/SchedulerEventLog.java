package dev.pipeline.scheduler.execution;

import dev.pipeline.scheduler.database.LifecycleStore;
import dev.pipeline.scheduler.model.EventLevel;
import dev.pipeline.scheduler.model.SchedulerEvent;

import java.time.Clock;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Appends {@link SchedulerEvent}s to the store. A failed write is logged and dropped. */
public class SchedulerEventLog {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerEventLog.class);

  private final LifecycleStore store;
  private final Clock clock;

  public SchedulerEventLog(LifecycleStore store, Clock clock) {
    this.store = store;
    this.clock = clock;
  }

  public void info(Long scheduleId, Long runId, String eventType, String message) {
    record(EventLevel.INFO, scheduleId, runId, eventType, message, Map.of());
  }

  public void record(
      EventLevel level,
      Long scheduleId,
      Long runId,
      String eventType,
      String message,
      Map<String, Object> details) {
    var event =
        SchedulerEvent.of(scheduleId, runId, level, eventType, message, details, clock.instant());
    try {
      store.recordSchedulerEvent(event);
    } catch (RuntimeException e) {
      logger.error("Failed to record scheduler event {}: {}", eventType, message, e);
    }
  }
}
