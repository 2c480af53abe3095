package dev.pipeline.scheduler.execution;

import dev.pipeline.scheduler.database.LifecycleStore;
import dev.pipeline.scheduler.exceptions.InvalidCronExpressionException;
import dev.pipeline.scheduler.exceptions.UnknownTimezoneException;
import dev.pipeline.scheduler.executor.JobExecutor;
import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.AttemptStatus;
import dev.pipeline.scheduler.model.CatchUpPolicy;
import dev.pipeline.scheduler.model.EventLevel;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.OverlapPolicy;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduledRun;
import dev.pipeline.scheduler.model.TriggeringEvent;
import dev.pipeline.scheduler.notifications.NotificationDispatcher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The scheduler's single control loop. Every poll interval it runs one {@link #tick()}:
 *
 * <ol>
 *   <li>fires due schedules, creating one run per missed slot under CATCH_UP or a single run under
 *       SKIP, and advances their next run time
 *   <li>relaunches runs that never got an attempt started
 *   <li>polls the job executor for attempts still queued or running and derives run state
 *   <li>starts retries whose backoff has elapsed
 *   <li>applies retention policies
 * </ol>
 *
 * A failure of one schedule, attempt or run is logged and does not stop the rest of its phase; a
 * failing phase does not stop the tick.
 */
public class SchedulerLoop {

  private static final Logger logger = LoggerFactory.getLogger(SchedulerLoop.class);

  private final LifecycleStore store;
  private final CronEvaluator cronEvaluator;
  private final AttemptLauncher launcher;
  private final NotificationDispatcher dispatcher;
  private final RetentionEnforcer retentionEnforcer;
  private final SchedulerEventLog eventLog;
  private final JobExecutor jobExecutor;
  private final Clock clock;
  private final Duration pollInterval;
  private final int maxCatchupRuns;
  private final String linkBaseUrl;

  private volatile boolean running = false;
  private Thread workerThread;
  private CountDownLatch shutdownLatch;

  public SchedulerLoop(
      LifecycleStore store,
      CronEvaluator cronEvaluator,
      AttemptLauncher launcher,
      NotificationDispatcher dispatcher,
      RetentionEnforcer retentionEnforcer,
      SchedulerEventLog eventLog,
      JobExecutor jobExecutor,
      Clock clock,
      Duration pollInterval,
      int maxCatchupRuns,
      String linkBaseUrl) {
    this.store = store;
    this.cronEvaluator = cronEvaluator;
    this.launcher = launcher;
    this.dispatcher = dispatcher;
    this.retentionEnforcer = retentionEnforcer;
    this.eventLog = eventLog;
    this.jobExecutor = jobExecutor;
    this.clock = clock;
    this.pollInterval = pollInterval;
    this.maxCatchupRuns = maxCatchupRuns;
    this.linkBaseUrl = linkBaseUrl;
  }

  private void pollLoop() {
    logger.debug("SchedulerLoop thread started");
    try {
      while (running) {
        try {
          tick();
        } catch (RuntimeException e) {
          logger.error("Scheduler tick failed", e);
        }

        try {
          Thread.sleep(pollInterval.toMillis());
        } catch (InterruptedException e) {
          if (running) {
            logger.warn("SchedulerLoop interrupted while sleeping");
          }
          running = false;
        }
      }
    } finally {
      shutdownLatch.countDown();
      logger.debug("SchedulerLoop thread has ended");
    }
  }

  public synchronized void start() {
    if (running) {
      logger.warn("SchedulerLoop is already running.");
      return;
    }
    running = true;
    shutdownLatch = new CountDownLatch(1);
    workerThread = new Thread(this::pollLoop, "SchedulerLoop");
    workerThread.setDaemon(true);
    workerThread.start();
    logger.info("Scheduler loop started, polling every {}", pollInterval);
  }

  public synchronized void stop() {
    if (!running) {
      logger.debug("SchedulerLoop is not running.");
      return;
    }
    running = false;
    workerThread.interrupt();
    try {
      shutdownLatch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    workerThread = null;
    logger.info("Scheduler loop stopped");
  }

  public boolean isRunning() {
    return running;
  }

  /** Runs every phase once, at the clock's current instant. */
  public void tick() {
    var now = clock.instant();
    logger.debug("Scheduler tick at {}", now);
    Set<Long> launched = new HashSet<>();
    phase("due schedules", () -> processDueSchedules(now, launched));
    phase("pending launches", () -> launchPending(launched));
    phase("attempt status sync", this::syncAttemptStatuses);
    phase("retries", () -> scheduleRetries(now));
    phase("retention", () -> retentionEnforcer.applyAll(now));
  }

  private void phase(String name, Runnable body) {
    try {
      body.run();
    } catch (RuntimeException e) {
      logger.error("Scheduler phase '{}' failed", name, e);
    }
  }

  // (a) due schedules

  private void processDueSchedules(Instant now, Set<Long> launched) {
    for (var schedule : store.findDueSchedules(now)) {
      try {
        processSchedule(schedule, now, launched);
      } catch (RuntimeException e) {
        logger.error("Failed to process schedule {} ({})", schedule.id(), schedule.name(), e);
      }
    }
  }

  void processSchedule(Schedule schedule, Instant now, Set<Long> launched) {
    var environment = store.getEnvironment(schedule.environmentId()).orElse(null);
    try {
      cronEvaluator.validate(schedule.cronExpression(), schedule.timezone());
      if (environment == null) {
        eventLog.record(
            EventLevel.ERROR,
            schedule.id(),
            null,
            "environment_missing",
            "Environment %d of schedule does not exist".formatted(schedule.environmentId()),
            Map.of("environment_id", schedule.environmentId()));
        store.advanceSchedule(schedule.id(), nextAfter(schedule, now), null);
        return;
      }

      var next = schedule.nextRunTime();
      var requireNoActiveRun = schedule.overlapPolicy() == OverlapPolicy.NO_OVERLAP;
      int created = 0;
      boolean blocked = false;
      while (!next.isAfter(now) && created < maxCatchupRuns) {
        var draft =
            ScheduledRun.pending(
                schedule.id(),
                TriggeringEvent.CRON,
                next,
                environment.snapshot(),
                schedule.command());
        var run = store.createScheduledRun(draft, requireNoActiveRun);
        if (run.isEmpty()) {
          blocked = true;
          break;
        }
        created++;
        eventLog.record(
            EventLevel.INFO,
            schedule.id(),
            run.get().id(),
            "run_created",
            "Run created for slot " + next,
            Map.of("scheduled_at", next.toString()));
        launched.add(run.get().id());
        launcher.submit(run.get());

        next = cronEvaluator.nextFireTime(schedule.cronExpression(), schedule.timezone(), next);
        store.advanceSchedule(schedule.id(), next, now);

        if (schedule.catchUpPolicy() == CatchUpPolicy.SKIP) {
          break;
        }
      }

      if (!next.isAfter(now)) {
        var future = nextAfter(schedule, now);
        if (blocked) {
          logger.info("Schedule {} has an active run, skipping slot {}", schedule.id(), next);
          eventLog.record(
              EventLevel.WARN,
              schedule.id(),
              null,
              "overlap_skipped",
              "Previous run still active, skipped firing",
              Map.of("skipped_slot", next.toString(), "next_run_time", future.toString()));
        } else if (schedule.catchUpPolicy() == CatchUpPolicy.CATCH_UP) {
          eventLog.record(
              EventLevel.WARN,
              schedule.id(),
              null,
              "catch_up_truncated",
              "Catch-up limit of %d runs reached, dropping remaining missed slots"
                  .formatted(maxCatchupRuns),
              Map.of("first_dropped_slot", next.toString(), "next_run_time", future.toString()));
        }
        store.advanceSchedule(schedule.id(), future, null);
      }
    } catch (InvalidCronExpressionException | UnknownTimezoneException e) {
      logger.error("Schedule {} stalled: {}", schedule.id(), e.getMessage());
      eventLog.record(
          EventLevel.ERROR,
          schedule.id(),
          null,
          "invalid_schedule",
          e.getMessage(),
          Map.of("cron_expression", schedule.cronExpression()));
      store.advanceSchedule(schedule.id(), null, null);
    }
  }

  private Instant nextAfter(Schedule schedule, Instant now) {
    return cronEvaluator.nextFireTime(schedule.cronExpression(), schedule.timezone(), now);
  }

  // (a') runs whose launch never happened, e.g. because the executor was at capacity

  private void launchPending(Set<Long> launchedThisTick) {
    for (var run : store.findPendingLaunches()) {
      if (launchedThisTick.contains(run.id()) || launcher.isInFlight(run.id())) {
        continue;
      }
      try {
        logger.debug("Relaunching pending run {}", run.id());
        launcher.submit(run);
      } catch (RuntimeException e) {
        logger.error("Failed to relaunch run {}", run.id(), e);
      }
    }
  }

  // (b) attempt status sync

  private void syncAttemptStatuses() {
    for (var attempt : store.findActiveAttempts()) {
      try {
        syncAttempt(attempt);
      } catch (RuntimeException e) {
        logger.error(
            "Failed to sync attempt {} of run {}",
            attempt.attemptNumber(),
            attempt.scheduledRunId(),
            e);
      }
    }
  }

  private void syncAttempt(Attempt attempt) {
    var status = jobExecutor.getJobStatus(attempt.jobHandle());
    var now = clock.instant();
    Attempt updated;
    switch (status.status()) {
      case QUEUED:
        return;
      case RUNNING:
        if (attempt.status() == AttemptStatus.RUNNING && attempt.startedAt() != null) {
          return;
        }
        updated =
            attempt
                .withStatus(AttemptStatus.RUNNING)
                .withStartedAt(firstNonNull(attempt.startedAt(), status.startedAt(), now));
        break;
      default:
        updated =
            attempt
                .withStatus(status.status())
                .withStartedAt(firstNonNull(attempt.startedAt(), status.startedAt(), null))
                .withFinishedAt(firstNonNull(status.finishedAt(), now, null))
                .withErrorMessage(
                    status.errorMessage() != null ? status.errorMessage() : attempt.errorMessage());
        break;
    }

    var run = store.getScheduledRun(attempt.scheduledRunId()).orElse(null);
    if (run == null) {
      return;
    }
    var schedule = store.getSchedule(run.scheduleId()).orElse(null);
    if (schedule == null) {
      return;
    }
    var attempts = new ArrayList<Attempt>();
    for (var a : store.listAttempts(run.id())) {
      attempts.add(a.attemptNumber() == updated.attemptNumber() ? updated : a);
    }
    var after = RunStateMachine.derive(run, attempts, schedule.retryPolicy(), linkBaseUrl);
    store.saveAttemptAndRun(updated, after);

    if (updated.isTerminal()) {
      var details = new LinkedHashMap<String, Object>();
      details.put("attempt_number", updated.attemptNumber());
      details.put("status", updated.status().name());
      if (updated.errorMessage() != null) {
        details.put("error_message", updated.errorMessage());
      }
      eventLog.record(
          updated.status() == AttemptStatus.SUCCEEDED ? EventLevel.INFO : EventLevel.WARN,
          schedule.id(),
          run.id(),
          "attempt_finished",
          "Attempt %d %s"
              .formatted(updated.attemptNumber(), updated.status().name().toLowerCase()),
          details);
    }
    fireTransition(schedule, run, after);
  }

  // (c) retries

  private void scheduleRetries(Instant now) {
    for (var run : store.findRetryCandidates()) {
      try {
        retryRun(run, now);
      } catch (RuntimeException e) {
        logger.error("Failed to schedule retry of run {}", run.id(), e);
      }
    }
  }

  private void retryRun(ScheduledRun run, Instant now) {
    if (run.status() != RunStatus.FAILURE || launcher.isInFlight(run.id())) {
      return;
    }
    var schedule = store.getSchedule(run.scheduleId()).orElse(null);
    if (schedule == null) {
      return;
    }
    var policy = schedule.retryPolicy();
    if (policy.maxRetries() <= 0) {
      exhaust(schedule, run, "no retries configured");
      return;
    }

    var attempts = store.listAttempts(run.id());
    if (attempts.isEmpty()) {
      return;
    }
    var latest = attempts.get(attempts.size() - 1);
    if (latest.status() != AttemptStatus.FAILED && latest.status() != AttemptStatus.CANCELLED) {
      return;
    }
    if (latest.finishedAt() == null) {
      return;
    }

    int nextAttempt = run.attemptsTotal() + 1;
    if (nextAttempt > RetryPolicyEngine.maxAttempts(policy)) {
      exhaust(schedule, run, "all %d attempts failed".formatted(run.attemptsTotal()));
      return;
    }
    var delay = RetryPolicyEngine.delay(policy, nextAttempt);
    if (now.isBefore(latest.finishedAt().plus(delay))) {
      return;
    }

    logger.info("Retrying run {} with attempt {} after {}", run.id(), nextAttempt, delay);
    eventLog.record(
        EventLevel.INFO,
        schedule.id(),
        run.id(),
        "retry_scheduled",
        "Starting attempt %d".formatted(nextAttempt),
        Map.of("attempt_number", nextAttempt, "delay_seconds", delay.toSeconds()));
    launcher.submit(run);
  }

  private void exhaust(Schedule schedule, ScheduledRun run, String reason) {
    var after = RunStateMachine.markExhausted(run);
    store.updateScheduledRun(after);
    logger.info("Run {} retries exhausted: {}", run.id(), reason);
    fireTransition(schedule, run, after);
  }

  private void fireTransition(Schedule schedule, ScheduledRun before, ScheduledRun after) {
    RunStateMachine.transitionTrigger(before, after)
        .ifPresent(
            trigger -> {
              eventLog.record(
                  levelOf(trigger),
                  schedule.id(),
                  after.id(),
                  trigger.label(),
                  "Run %d %s".formatted(after.id(), after.status().name().toLowerCase()),
                  Map.of(
                      "status", after.status().name(),
                      "retry_status", after.retryStatus().name(),
                      "attempts_total", after.attemptsTotal()));
              dispatcher.dispatch(schedule, after, trigger);
            });
  }

  private static EventLevel levelOf(NotificationTrigger trigger) {
    switch (trigger) {
      case RUN_FAILED:
        return EventLevel.ERROR;
      case RUN_CANCELLED:
        return EventLevel.WARN;
      default:
        return EventLevel.INFO;
    }
  }

  private static Instant firstNonNull(Instant a, Instant b, Instant c) {
    return a != null ? a : b != null ? b : c;
  }
}
