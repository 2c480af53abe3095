package dev.pipeline.scheduler.model;

import java.time.Instant;

/**
 * Run counts for one schedule.
 *
 * @param retryExhaustedRuns runs whose retries ran out, whatever their final status
 * @param lastRunStatus status of the newest run, or null when the schedule never fired
 */
public record ScheduleMetrics(
    long scheduleId,
    long totalRuns,
    long successfulRuns,
    long failedRuns,
    long cancelledRuns,
    long skippedRuns,
    long retryExhaustedRuns,
    RunStatus lastRunStatus,
    Instant lastRunTime) {}
