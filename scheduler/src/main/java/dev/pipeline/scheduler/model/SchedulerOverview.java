package dev.pipeline.scheduler.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Scheduler-wide counters and the upcoming firing of every active schedule. */
public record SchedulerOverview(
    boolean running,
    long totalSchedules,
    long activeSchedules,
    long pausedSchedules,
    Map<RunStatus, Long> runsByStatus,
    List<UpcomingRun> upcomingRuns) {

  public SchedulerOverview {
    runsByStatus = runsByStatus == null ? Map.of() : Map.copyOf(runsByStatus);
    upcomingRuns = upcomingRuns == null ? List.of() : List.copyOf(upcomingRuns);
  }

  public record UpcomingRun(long scheduleId, String scheduleName, Instant nextRunTime) {}
}
