package dev.pipeline.scheduler.execution;

import dev.pipeline.scheduler.database.LifecycleStore;
import dev.pipeline.scheduler.exceptions.AttemptConflictException;
import dev.pipeline.scheduler.exceptions.ConcurrencyLimitReachedException;
import dev.pipeline.scheduler.exceptions.NonExistentRunException;
import dev.pipeline.scheduler.exceptions.NonExistentScheduleException;
import dev.pipeline.scheduler.executor.JobExecutor;
import dev.pipeline.scheduler.executor.LaunchParameters;
import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.AttemptStatus;
import dev.pipeline.scheduler.model.EventLevel;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.ScheduledRun;
import dev.pipeline.scheduler.notifications.NotificationDispatcher;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts attempts of scheduled runs on the {@link JobExecutor} and records them. At most one
 * launch per run is in progress at any time.
 */
public class AttemptLauncher {

  private static final Logger logger = LoggerFactory.getLogger(AttemptLauncher.class);

  private final LifecycleStore store;
  private final JobExecutor jobExecutor;
  private final NotificationDispatcher dispatcher;
  private final SchedulerEventLog eventLog;
  private final Executor launchPool;
  private final Clock clock;
  private final String linkBaseUrl;

  private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

  public AttemptLauncher(
      LifecycleStore store,
      JobExecutor jobExecutor,
      NotificationDispatcher dispatcher,
      SchedulerEventLog eventLog,
      Executor launchPool,
      Clock clock,
      String linkBaseUrl) {
    this.store = store;
    this.jobExecutor = jobExecutor;
    this.dispatcher = dispatcher;
    this.eventLog = eventLog;
    this.launchPool = launchPool;
    this.clock = clock;
    this.linkBaseUrl = linkBaseUrl;
  }

  /**
   * Starts the next attempt of {@code run} on the calling thread.
   *
   * @return the recorded attempt, or empty if the executor had no free slot, another launch of
   *     the run is in progress, or another attempt was recorded first
   */
  public Optional<Attempt> startAttempt(ScheduledRun run) {
    long runId = run.id();
    if (!inFlight.add(runId)) {
      logger.debug("Launch of run {} already in progress", runId);
      return Optional.empty();
    }
    try {
      return launch(runId);
    } finally {
      inFlight.remove(runId);
    }
  }

  /**
   * Queues a launch of {@code run} on the launch pool.
   *
   * @return false if a launch of the run is already queued or running
   */
  public boolean submit(ScheduledRun run) {
    long runId = run.id();
    if (!inFlight.add(runId)) {
      return false;
    }
    try {
      launchPool.execute(
          () -> {
            try {
              launch(runId);
            } catch (RuntimeException e) {
              logger.error("Launch of run {} failed", runId, e);
            } finally {
              inFlight.remove(runId);
            }
          });
    } catch (RuntimeException e) {
      inFlight.remove(runId);
      throw e;
    }
    return true;
  }

  public boolean isInFlight(long runId) {
    return inFlight.contains(runId);
  }

  private Optional<Attempt> launch(long runId) {
    var run = store.getScheduledRun(runId).orElseThrow(() -> new NonExistentRunException(runId));
    if (run.isTerminal()) {
      logger.info("Run {} finished as {} before its launch; nothing started", runId, run.status());
      return Optional.empty();
    }
    var schedule =
        store
            .getSchedule(run.scheduleId())
            .orElseThrow(() -> new NonExistentScheduleException(run.scheduleId()));
    var policy = schedule.retryPolicy();
    int attemptNumber = run.attemptsTotal() + 1;
    var parameters = LaunchParameters.fromSnapshot(run.environmentSnapshot());

    String jobHandle;
    try {
      jobHandle = jobExecutor.startJob(run.command(), parameters);
    } catch (ConcurrencyLimitReachedException e) {
      logger.warn(
          "Executor at capacity, attempt {} of run {} stays pending", attemptNumber, runId);
      eventLog.record(
          EventLevel.WARN,
          schedule.id(),
          runId,
          "executor_at_capacity",
          e.getMessage(),
          Map.of("attempt_number", attemptNumber, "limit", e.limit()));
      return Optional.empty();
    } catch (RuntimeException e) {
      eventLog.record(
          EventLevel.ERROR,
          schedule.id(),
          runId,
          "attempt_launch_failed",
          "Failed to start attempt %d: %s".formatted(attemptNumber, e.getMessage()),
          Map.of("attempt_number", attemptNumber));
      throw e;
    }

    var now = clock.instant();
    var links = RunStateMachine.links(linkBaseUrl, jobHandle);
    var launched =
        run.withAttemptsTotal(attemptNumber)
            .withStatus(RunStatus.SKIPPED)
            .withRetryStatus(RunStateMachine.launchRetryStatus(policy))
            .withQueuedAt(now)
            .withStartedAt(null)
            .withFinishedAt(null)
            .withLinks(links.get(0), links.get(1));
    var attempt =
        new Attempt(
            null, runId, attemptNumber, jobHandle, AttemptStatus.QUEUED, now, null, null, null);

    Attempt recorded;
    try {
      recorded = store.recordAttempt(launched, attempt);
    } catch (AttemptConflictException e) {
      logger.warn("{}; cancelling job {}", e.getMessage(), jobHandle);
      jobExecutor.cancelJob(jobHandle);
      return Optional.empty();
    }

    logger.info(
        "Started attempt {} of run {} (schedule {}) as job {}",
        attemptNumber,
        runId,
        schedule.id(),
        jobHandle);
    eventLog.record(
        EventLevel.INFO,
        schedule.id(),
        runId,
        "attempt_started",
        "Attempt %d started".formatted(attemptNumber),
        Map.of("attempt_number", attemptNumber, "job_handle", jobHandle));
    dispatcher.dispatch(schedule, launched, NotificationTrigger.RUN_STARTED);
    return Optional.of(recorded);
  }
}
