package dev.pipeline.scheduler;

import dev.pipeline.scheduler.config.SchedulerConfig;
import dev.pipeline.scheduler.database.LifecycleStore;
import dev.pipeline.scheduler.database.SystemDatabase;
import dev.pipeline.scheduler.exceptions.InvalidCronExpressionException;
import dev.pipeline.scheduler.exceptions.NonExistentEnvironmentException;
import dev.pipeline.scheduler.exceptions.NonExistentRunException;
import dev.pipeline.scheduler.exceptions.NonExistentScheduleException;
import dev.pipeline.scheduler.exceptions.ScheduleOverlapConflictException;
import dev.pipeline.scheduler.exceptions.UnknownTimezoneException;
import dev.pipeline.scheduler.execution.AttemptLauncher;
import dev.pipeline.scheduler.execution.CronEvaluator;
import dev.pipeline.scheduler.execution.RetentionEnforcer;
import dev.pipeline.scheduler.execution.RunStateMachine;
import dev.pipeline.scheduler.execution.SchedulerEventLog;
import dev.pipeline.scheduler.execution.SchedulerLoop;
import dev.pipeline.scheduler.executor.JobExecutor;
import dev.pipeline.scheduler.migrations.MigrationManager;
import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.Environment;
import dev.pipeline.scheduler.model.EventLevel;
import dev.pipeline.scheduler.model.NotificationConfig;
import dev.pipeline.scheduler.model.NotificationEvent;
import dev.pipeline.scheduler.model.NotificationTestResult;
import dev.pipeline.scheduler.model.OverlapPolicy;
import dev.pipeline.scheduler.model.RetryStatus;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduleMetrics;
import dev.pipeline.scheduler.model.ScheduleStatus;
import dev.pipeline.scheduler.model.ScheduledRun;
import dev.pipeline.scheduler.model.SchedulerEvent;
import dev.pipeline.scheduler.model.SchedulerOverview;
import dev.pipeline.scheduler.model.TriggeringEvent;
import dev.pipeline.scheduler.notifications.EmailNotificationSender;
import dev.pipeline.scheduler.notifications.NotificationDispatcher;
import dev.pipeline.scheduler.notifications.NotificationSender;
import dev.pipeline.scheduler.notifications.SlackNotificationSender;
import dev.pipeline.scheduler.notifications.WebhookNotificationSender;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the scheduler. Owns the scheduler loop and the two background pools that launch
 * attempts and deliver notifications, and exposes the operations of the management API.
 *
 * <pre>{@code
 * var config = SchedulerConfig.defaultsFromEnv("pipelines");
 * try (var scheduler = new PipelineScheduler(config, new ProcessJobExecutor(logDir, 4))) {
 *   scheduler.launch();
 *   ...
 * }
 * }</pre>
 */
public class PipelineScheduler implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(PipelineScheduler.class);

  private final SchedulerConfig config;
  private final LifecycleStore store;
  private final JobExecutor jobExecutor;
  private final Clock clock;
  private final Executor launchPool;
  private final Executor notificationPool;
  private final boolean ownsStore;

  private final CronEvaluator cronEvaluator;
  private final SchedulerEventLog eventLog;
  private final NotificationDispatcher dispatcher;
  private final AttemptLauncher launcher;
  private final RetentionEnforcer retentionEnforcer;
  private final SchedulerLoop loop;

  private final AtomicBoolean isRunning = new AtomicBoolean(false);

  /** Scheduler backed by the Postgres database of {@code config}, migrated first if configured. */
  public PipelineScheduler(SchedulerConfig config, JobExecutor jobExecutor) {
    this(
        config,
        openDatabase(config),
        true,
        jobExecutor,
        defaultSenders(config),
        newPool("pipesched-launch", config.launchWorkers()),
        newPool("pipesched-notify", config.notificationWorkers()),
        Clock.systemUTC());
  }

  /**
   * Scheduler over an existing store. Pools that are {@link ExecutorService}s are shut down by
   * {@link #close()}; the store is left open.
   */
  public PipelineScheduler(
      SchedulerConfig config,
      LifecycleStore store,
      JobExecutor jobExecutor,
      List<NotificationSender> senders,
      Executor launchPool,
      Executor notificationPool,
      Clock clock) {
    this(config, store, false, jobExecutor, senders, launchPool, notificationPool, clock);
  }

  private PipelineScheduler(
      SchedulerConfig config,
      LifecycleStore store,
      boolean ownsStore,
      JobExecutor jobExecutor,
      List<NotificationSender> senders,
      Executor launchPool,
      Executor notificationPool,
      Clock clock) {
    this.config = Objects.requireNonNull(config);
    this.store = Objects.requireNonNull(store);
    this.ownsStore = ownsStore;
    this.jobExecutor = Objects.requireNonNull(jobExecutor);
    this.clock = Objects.requireNonNull(clock);
    this.launchPool = launchPool;
    this.notificationPool = notificationPool;

    cronEvaluator = new CronEvaluator(config.defaultTimezone());
    eventLog = new SchedulerEventLog(store, clock);
    dispatcher = new NotificationDispatcher(store, senders, notificationPool, clock);
    launcher =
        new AttemptLauncher(
            store, jobExecutor, dispatcher, eventLog, launchPool, clock, config.runLinkBaseUrl());
    retentionEnforcer = new RetentionEnforcer(store, eventLog);
    loop =
        new SchedulerLoop(
            store,
            cronEvaluator,
            launcher,
            dispatcher,
            retentionEnforcer,
            eventLog,
            jobExecutor,
            clock,
            config.pollInterval(),
            config.maxCatchupRuns(),
            config.runLinkBaseUrl());
  }

  private static LifecycleStore openDatabase(SchedulerConfig config) {
    if (config.migrate()) {
      MigrationManager.runMigrations(config);
    }
    return new SystemDatabase(config);
  }

  private static List<NotificationSender> defaultSenders(SchedulerConfig config) {
    var settings = config.notifications();
    return List.of(
        new SlackNotificationSender(settings.httpTimeout()),
        new EmailNotificationSender(settings),
        new WebhookNotificationSender(settings.httpTimeout()));
  }

  private static ExecutorService newPool(String name, int threads) {
    var counter = new AtomicInteger();
    return Executors.newFixedThreadPool(
        threads,
        r -> {
          var t = new Thread(r, name + "-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  /** Starts the scheduler loop, unless disabled in the configuration. */
  public void launch() {
    if (isRunning.compareAndSet(false, true)) {
      logger.info("Starting scheduler {}", config.appName());
      if (config.schedulerEnabled()) {
        loop.start();
      } else {
        logger.info("Scheduler loop disabled; API operations only");
      }
    } else {
      logger.warn("Scheduler already started");
    }
  }

  /**
   * Stops the loop, then waits up to the configured shutdown timeout for queued launches and
   * notifications to finish.
   */
  public void shutdown() {
    if (isRunning.compareAndSet(true, false)) {
      loop.stop();
    }
    var deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
    for (var pool : List.of(launchPool, notificationPool)) {
      if (pool instanceof ExecutorService service && !service.isShutdown()) {
        service.shutdown();
        try {
          long remaining = Math.max(0, deadline - System.nanoTime());
          if (!service.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
            logger.warn("Background tasks still running after {}", config.shutdownTimeout());
            service.shutdownNow();
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          service.shutdownNow();
        }
      }
    }
    if (ownsStore && store instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.warn("Failed to close the scheduler store", e);
      }
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  public boolean isRunning() {
    return loop.isRunning();
  }

  /** Runs one iteration of the scheduler loop on the calling thread. */
  public void tick() {
    loop.tick();
  }

  // Environments

  public Environment createEnvironment(Environment environment) {
    var created = store.createEnvironment(environment);
    logger.info("Created environment {} ({})", created.id(), created.name());
    return created;
  }

  public Environment getEnvironment(long environmentId) {
    return store
        .getEnvironment(environmentId)
        .orElseThrow(() -> new NonExistentEnvironmentException(environmentId));
  }

  /** Lists environments, creating the {@code default} environment when there is none. */
  public List<Environment> listEnvironments() {
    var environments = store.listEnvironments();
    if (environments.isEmpty()) {
      var created = createEnvironment(new Environment(Constants.DEFAULT_ENVIRONMENT_NAME));
      return List.of(created);
    }
    return environments;
  }

  public Environment updateEnvironment(Environment environment) {
    Objects.requireNonNull(environment.id(), "Environment id must not be null");
    return store.updateEnvironment(environment);
  }

  /**
   * @throws IllegalStateException if schedules still use the environment
   */
  public void deleteEnvironment(long environmentId) {
    getEnvironment(environmentId);
    var schedules = store.listSchedulesForEnvironment(environmentId);
    if (!schedules.isEmpty()) {
      throw new IllegalStateException(
          "Environment %d is used by %d schedules".formatted(environmentId, schedules.size()));
    }
    store.deleteEnvironment(environmentId);
    logger.info("Deleted environment {}", environmentId);
  }

  // Schedules

  /**
   * Stores a new schedule and computes its first run time. A schedule whose cron expression or
   * timezone is invalid is stored without a next run time and an error is logged for it.
   *
   * @throws NonExistentEnvironmentException if the schedule's environment does not exist
   */
  public Schedule createSchedule(Schedule schedule) {
    getEnvironment(schedule.environmentId());
    var now = clock.instant();
    String cronError = null;
    Instant next = null;
    if (schedule.enabled()) {
      try {
        next = cronEvaluator.nextFireTime(schedule.cronExpression(), schedule.timezone(), now);
      } catch (InvalidCronExpressionException | UnknownTimezoneException e) {
        cronError = e.getMessage();
      }
    }
    var created =
        store.createSchedule(
            schedule.withEnabled(schedule.enabled()).withNextRunTime(next).withLastRunTime(null));
    eventLog.info(created.id(), null, "schedule_created", "Schedule created");
    reportCronError(created, cronError);
    logger.info("Created schedule {} ({}), next run {}", created.id(), created.name(), next);
    return created;
  }

  public Schedule getSchedule(long scheduleId) {
    return store
        .getSchedule(scheduleId)
        .orElseThrow(() -> new NonExistentScheduleException(scheduleId));
  }

  public List<Schedule> listSchedules() {
    return store.listSchedules();
  }

  /**
   * Replaces the definition of a schedule. The next run time is recomputed when an enabled
   * schedule gets a new cron expression or timezone, or is re-enabled. Disabling a schedule keeps
   * its next run time frozen, as {@link #pauseSchedule} does.
   */
  public Schedule updateSchedule(Schedule schedule) {
    Objects.requireNonNull(schedule.id(), "Schedule id must not be null");
    var existing = getSchedule(schedule.id());
    if (schedule.environmentId() != existing.environmentId()) {
      getEnvironment(schedule.environmentId());
    }
    var updated =
        schedule
            .withEnabled(schedule.enabled())
            .withNextRunTime(existing.nextRunTime())
            .withLastRunTime(existing.lastRunTime())
            .withCreatedBy(existing.createdBy());
    boolean recompute =
        schedule.enabled()
            && (!Objects.equals(existing.cronExpression(), schedule.cronExpression())
                || !Objects.equals(existing.timezone(), schedule.timezone())
                || !existing.enabled()
                || existing.nextRunTime() == null);
    String cronError = null;
    if (recompute) {
      Instant next = null;
      try {
        next =
            cronEvaluator.nextFireTime(
                schedule.cronExpression(), schedule.timezone(), clock.instant());
      } catch (InvalidCronExpressionException | UnknownTimezoneException e) {
        cronError = e.getMessage();
      }
      updated = updated.withNextRunTime(next);
    }
    var stored = store.updateSchedule(updated);
    eventLog.info(stored.id(), null, "schedule_updated", "Schedule updated");
    reportCronError(stored, cronError);
    return stored;
  }

  private void reportCronError(Schedule schedule, @Nullable String cronError) {
    if (cronError != null) {
      logger.error("Schedule {} will not fire: {}", schedule.id(), cronError);
      eventLog.record(
          EventLevel.ERROR,
          schedule.id(),
          null,
          "invalid_schedule",
          cronError,
          Map.of("cron_expression", schedule.cronExpression()));
    }
  }

  /** Deletes a schedule with its runs, attempts and notification records. */
  public void deleteSchedule(long scheduleId) {
    if (!store.deleteSchedule(scheduleId)) {
      throw new NonExistentScheduleException(scheduleId);
    }
    eventLog.info(scheduleId, null, "schedule_deleted", "Schedule deleted");
    logger.info("Deleted schedule {}", scheduleId);
  }

  /** Disables a schedule. Its next run time is kept as it was. */
  public Schedule pauseSchedule(long scheduleId) {
    var schedule = getSchedule(scheduleId);
    var paused = store.updateSchedule(schedule.withEnabled(false));
    eventLog.info(scheduleId, null, "schedule_paused", "Schedule paused");
    return paused;
  }

  /** Enables a schedule and recomputes its next run time from now. */
  public Schedule resumeSchedule(long scheduleId) {
    var schedule = getSchedule(scheduleId);
    String cronError = null;
    Instant next = null;
    try {
      next =
          cronEvaluator.nextFireTime(
              schedule.cronExpression(), schedule.timezone(), clock.instant());
    } catch (InvalidCronExpressionException | UnknownTimezoneException e) {
      cronError = e.getMessage();
    }
    var resumed = store.updateSchedule(schedule.withEnabled(true).withNextRunTime(next));
    eventLog.info(scheduleId, null, "schedule_resumed", "Schedule resumed");
    reportCronError(resumed, cronError);
    return resumed;
  }

  // Runs

  /**
   * Creates a manually triggered run and starts its first attempt on the calling thread. If the
   * executor has no free slot the run is created without an attempt and the scheduler loop
   * launches it later.
   *
   * @throws ScheduleOverlapConflictException if the schedule does not allow overlapping runs and
   *     one is active
   */
  public ScheduledRun runNow(long scheduleId) {
    var schedule = getSchedule(scheduleId);
    var environment = getEnvironment(schedule.environmentId());
    var draft =
        ScheduledRun.pending(
            scheduleId,
            TriggeringEvent.MANUAL,
            clock.instant(),
            environment.snapshot(),
            schedule.command());
    var run =
        store
            .createScheduledRun(draft, schedule.overlapPolicy() == OverlapPolicy.NO_OVERLAP)
            .orElseThrow(() -> new ScheduleOverlapConflictException(scheduleId));
    eventLog.info(scheduleId, run.id(), "run_created", "Run triggered manually");
    launcher.startAttempt(run);
    return store.getScheduledRun(run.id()).orElse(run);
  }

  /**
   * Asks the executor to cancel the run's current attempt. The cancellation is picked up by the
   * next status sync. A run that is active without a live attempt, because it is still waiting
   * for its first launch or for a retry, is cancelled directly.
   *
   * @return false if the run has already finished
   */
  public boolean cancelRun(long runId) {
    var run = getRun(runId);
    var attempts = store.listAttempts(runId);
    var current = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    if (current != null && !current.isTerminal()) {
      boolean accepted = jobExecutor.cancelJob(current.jobHandle());
      eventLog.record(
          EventLevel.INFO,
          run.scheduleId(),
          runId,
          "cancel_requested",
          "Cancellation of attempt %d requested".formatted(current.attemptNumber()),
          Map.of("job_handle", current.jobHandle(), "accepted", accepted));
      return accepted;
    }
    if (run.isTerminal()) {
      return false;
    }
    var after =
        run.withStatus(RunStatus.CANCELLED)
            .withRetryStatus(RetryStatus.EXHAUSTED)
            .withFinishedAt(clock.instant());
    store.updateScheduledRun(after);
    logger.info("Cancelled run {} with no live attempt", runId);
    var schedule = getSchedule(run.scheduleId());
    RunStateMachine.transitionTrigger(run, after)
        .ifPresent(
            trigger -> {
              eventLog.record(
                  EventLevel.WARN,
                  schedule.id(),
                  runId,
                  trigger.label(),
                  "Run %d cancelled before its next attempt".formatted(runId),
                  Map.of("attempts_total", run.attemptsTotal()));
              dispatcher.dispatch(schedule, after, trigger);
            });
    return true;
  }

  public ScheduledRun getRun(long runId) {
    return store.getScheduledRun(runId).orElseThrow(() -> new NonExistentRunException(runId));
  }

  /** Runs of a schedule, newest first */
  public List<ScheduledRun> listRuns(long scheduleId) {
    getSchedule(scheduleId);
    return store.listRunsForSchedule(scheduleId);
  }

  public List<Attempt> listAttempts(long runId) {
    getRun(runId);
    return store.listAttempts(runId);
  }

  public List<NotificationEvent> listNotifications(long runId) {
    return store.listNotificationEvents(runId);
  }

  // Monitoring

  public SchedulerOverview overview() {
    var schedules = store.listSchedules();
    long active = schedules.stream().filter(s -> s.status() == ScheduleStatus.ACTIVE).count();
    List<SchedulerOverview.UpcomingRun> upcoming = new ArrayList<>();
    schedules.stream()
        .filter(s -> s.enabled() && s.nextRunTime() != null)
        .sorted(Comparator.comparing(Schedule::nextRunTime))
        .forEach(
            s ->
                upcoming.add(new SchedulerOverview.UpcomingRun(s.id(), s.name(), s.nextRunTime())));
    return new SchedulerOverview(
        loop.isRunning(),
        schedules.size(),
        active,
        schedules.size() - active,
        store.countRunsByStatus(),
        upcoming);
  }

  public ScheduleMetrics metrics(long scheduleId) {
    var runs = listRuns(scheduleId);
    long success = 0, failure = 0, cancelled = 0, skipped = 0, exhausted = 0;
    for (var run : runs) {
      switch (run.status()) {
        case SUCCESS:
          success++;
          break;
        case FAILURE:
          failure++;
          break;
        case CANCELLED:
          cancelled++;
          break;
        case SKIPPED:
          skipped++;
          break;
      }
      if (run.retryStatus() == RetryStatus.EXHAUSTED && run.status() != RunStatus.CANCELLED) {
        exhausted++;
      }
    }
    var last = runs.isEmpty() ? null : runs.get(0);
    return new ScheduleMetrics(
        scheduleId,
        runs.size(),
        success,
        failure,
        cancelled,
        skipped,
        exhausted,
        last == null ? null : last.status(),
        last == null ? null : last.scheduledAt());
  }

  /** Scheduler log of one schedule, or of every schedule when {@code scheduleId} is null */
  public List<SchedulerEvent> logs(@Nullable Long scheduleId, int limit) {
    return store.listSchedulerEvents(scheduleId, limit);
  }

  // Notifications

  public List<NotificationTestResult> testNotifications(long scheduleId) {
    var schedule = getSchedule(scheduleId);
    return dispatcher.sendTest(schedule.name(), schedule.notificationConfig());
  }

  public List<NotificationTestResult> testNotifications(NotificationConfig config) {
    return dispatcher.sendTest("notification test", config);
  }
}
