package dev.pipeline.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pipeline.scheduler.config.SchedulerConfig;
import dev.pipeline.scheduler.exceptions.NonExistentEnvironmentException;
import dev.pipeline.scheduler.exceptions.NonExistentScheduleException;
import dev.pipeline.scheduler.exceptions.ScheduleOverlapConflictException;
import dev.pipeline.scheduler.model.AttemptStatus;
import dev.pipeline.scheduler.model.CatchUpPolicy;
import dev.pipeline.scheduler.model.Environment;
import dev.pipeline.scheduler.model.NotificationChannelType;
import dev.pipeline.scheduler.model.NotificationConfig;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.OverlapPolicy;
import dev.pipeline.scheduler.model.RetryPolicy;
import dev.pipeline.scheduler.model.RetryStatus;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduleStatus;
import dev.pipeline.scheduler.model.SlackChannel;
import dev.pipeline.scheduler.model.TriggeringEvent;
import dev.pipeline.scheduler.model.WebhookChannel;
import dev.pipeline.scheduler.notifications.NotificationSender;
import dev.pipeline.scheduler.notifications.SendResult;
import dev.pipeline.scheduler.utils.FakeJobExecutor;
import dev.pipeline.scheduler.utils.InMemoryLifecycleStore;
import dev.pipeline.scheduler.utils.MutableClock;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

@Timeout(value = 1, unit = TimeUnit.MINUTES)
class PipelineSchedulerTest {

  private MutableClock clock;
  private InMemoryLifecycleStore store;
  private FakeJobExecutor executor;
  private NotificationSender webhook;
  private PipelineScheduler scheduler;
  private Environment env;

  @BeforeEach
  void beforeEachTest() {
    clock = MutableClock.at("2024-01-01T00:00:00Z");
    store = new InMemoryLifecycleStore(clock);
    executor = new FakeJobExecutor();
    webhook = mock(NotificationSender.class);
    when(webhook.type()).thenReturn(NotificationChannelType.WEBHOOK);
    when(webhook.send(any(), any(), any())).thenReturn(SendResult.ok());

    var config =
        SchedulerConfig.defaults("scheduler-test")
            .withSchedulerEnabled(false)
            .withMaxCatchupRuns(5);
    // launches and notifications run on the ticking thread
    scheduler =
        new PipelineScheduler(
            config, store, executor, List.of(webhook), Runnable::run, Runnable::run, clock);
    env =
        scheduler.createEnvironment(
            new Environment("prod").withTargetName("prod").withVariables(Map.of("region", "eu")));
  }

  @AfterEach
  void afterEachTest() {
    scheduler.close();
  }

  private Schedule hourly(CatchUpPolicy catchUp, OverlapPolicy overlap) {
    return scheduler.createSchedule(
        new Schedule("hourly-models", "0 * * * *", "UTC", "dbt run --select tag:hourly", env.id())
            .withCatchUpPolicy(catchUp)
            .withOverlapPolicy(overlap)
            .withNotificationConfig(
                NotificationConfig.empty()
                    .withWebhook(new WebhookChannel("http://hooks.example.com/runs"))));
  }

  private void tickAt(String isoInstant) {
    clock.set(Instant.parse(isoInstant));
    scheduler.tick();
  }

  @Test
  public void createComputesFirstRunTime() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);
    assertEquals(Instant.parse("2024-01-01T01:00:00Z"), schedule.nextRunTime());
    assertEquals(ScheduleStatus.ACTIVE, schedule.status());
    assertEquals(1, store.schedulerEvents("schedule_created").size());
  }

  @Test
  public void catchUpCreatesRunPerMissedSlot() {
    var schedule = hourly(CatchUpPolicy.CATCH_UP, OverlapPolicy.ALLOW_OVERLAP);

    tickAt("2024-01-01T03:30:00Z");

    var runs = scheduler.listRuns(schedule.id());
    assertEquals(3, runs.size());
    assertEquals(Instant.parse("2024-01-01T03:00:00Z"), runs.get(0).scheduledAt());
    assertEquals(Instant.parse("2024-01-01T02:00:00Z"), runs.get(1).scheduledAt());
    assertEquals(Instant.parse("2024-01-01T01:00:00Z"), runs.get(2).scheduledAt());
    for (var run : runs) {
      assertEquals(TriggeringEvent.CRON, run.triggeringEvent());
      assertEquals(1, run.attemptsTotal());
      assertEquals("prod", run.environmentSnapshot().get("target_name"));
    }
    assertEquals(3, executor.started().size());
    assertEquals("prod", executor.started().get(0).parameters().targetName());

    var stored = scheduler.getSchedule(schedule.id());
    assertEquals(Instant.parse("2024-01-01T04:00:00Z"), stored.nextRunTime());
    assertEquals(Instant.parse("2024-01-01T03:30:00Z"), stored.lastRunTime());
  }

  @Test
  public void catchUpIsBoundedByMaxCatchupRuns() {
    var schedule = hourly(CatchUpPolicy.CATCH_UP, OverlapPolicy.ALLOW_OVERLAP);

    tickAt("2024-01-01T09:30:00Z");

    assertEquals(5, scheduler.listRuns(schedule.id()).size());
    assertEquals(1, store.schedulerEvents("catch_up_truncated").size());
    assertEquals(
        Instant.parse("2024-01-01T10:00:00Z"), scheduler.getSchedule(schedule.id()).nextRunTime());
  }

  @Test
  public void skipCreatesSingleRun() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.ALLOW_OVERLAP);

    tickAt("2024-01-01T03:30:00Z");

    var runs = scheduler.listRuns(schedule.id());
    assertEquals(1, runs.size());
    assertEquals(Instant.parse("2024-01-01T01:00:00Z"), runs.get(0).scheduledAt());
    assertEquals(
        Instant.parse("2024-01-01T04:00:00Z"), scheduler.getSchedule(schedule.id()).nextRunTime());
  }

  @Test
  public void noOverlapSkipsWhileRunActive() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);

    tickAt("2024-01-01T01:00:30Z");
    assertEquals(1, scheduler.listRuns(schedule.id()).size());
    var firstJob = executor.lastHandle();

    tickAt("2024-01-01T02:00:30Z");
    assertEquals(1, scheduler.listRuns(schedule.id()).size());
    assertEquals(1, store.schedulerEvents("overlap_skipped").size());
    assertEquals(
        Instant.parse("2024-01-01T03:00:00Z"), scheduler.getSchedule(schedule.id()).nextRunTime());

    executor.succeed(firstJob, Instant.parse("2024-01-01T02:10:00Z"));
    tickAt("2024-01-01T02:30:00Z");
    var first = scheduler.listRuns(schedule.id()).get(0);
    assertEquals(RunStatus.SUCCESS, first.status());
    assertEquals(RetryStatus.NOT_APPLICABLE, first.retryStatus());

    tickAt("2024-01-01T03:00:30Z");
    assertEquals(2, scheduler.listRuns(schedule.id()).size());
  }

  @Test
  public void failedNotificationFiresOnceWhenRetriesExhausted() {
    var schedule =
        scheduler.updateSchedule(
            hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP)
                .withRetryPolicy(RetryPolicy.fixed(2, 10)));

    tickAt("2024-01-01T01:00:00Z");
    var runId = scheduler.listRuns(schedule.id()).get(0).id();

    // attempt 1 fails, retry after 10s
    executor.fail(executor.lastHandle(), Instant.parse("2024-01-01T01:00:05Z"), "exit code 1");
    tickAt("2024-01-01T01:00:10Z");
    var run = scheduler.getRun(runId);
    assertEquals(RunStatus.FAILURE, run.status());
    assertEquals(RetryStatus.IN_PROGRESS, run.retryStatus());
    assertEquals(1, executor.started().size());

    tickAt("2024-01-01T01:00:20Z");
    assertEquals(2, executor.started().size());
    assertEquals(2, scheduler.getRun(runId).attemptsTotal());

    executor.fail(executor.lastHandle(), Instant.parse("2024-01-01T01:00:25Z"), "exit code 1");
    tickAt("2024-01-01T01:00:40Z");
    assertEquals(3, executor.started().size());

    executor.fail(executor.lastHandle(), Instant.parse("2024-01-01T01:00:45Z"), "exit code 2");
    tickAt("2024-01-01T01:01:00Z");
    tickAt("2024-01-01T01:02:00Z");
    tickAt("2024-01-01T01:03:00Z");

    run = scheduler.getRun(runId);
    assertEquals(RunStatus.FAILURE, run.status());
    assertEquals(RetryStatus.EXHAUSTED, run.retryStatus());
    assertEquals(3, run.attemptsTotal());
    assertTrue(run.isTerminal());
    assertEquals(3, executor.started().size());

    var attempts = scheduler.listAttempts(runId);
    assertEquals(List.of(1, 2, 3), attempts.stream().map(a -> a.attemptNumber()).toList());
    assertTrue(attempts.stream().allMatch(a -> a.status() == AttemptStatus.FAILED));
    assertEquals("exit code 2", attempts.get(2).errorMessage());

    verify(webhook, times(1)).send(any(), eq(NotificationTrigger.RUN_FAILED), any());
    verify(webhook, times(3)).send(any(), eq(NotificationTrigger.RUN_STARTED), any());
    assertEquals(1, store.schedulerEvents("run_failed").size());

    var notifications = scheduler.listNotifications(runId);
    assertEquals(4, notifications.size());

    var metrics = scheduler.metrics(schedule.id());
    assertEquals(1, metrics.totalRuns());
    assertEquals(1, metrics.failedRuns());
    assertEquals(1, metrics.retryExhaustedRuns());
  }

  @Test
  public void runWithoutRetriesFailsImmediately() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);
    tickAt("2024-01-01T01:00:00Z");
    executor.fail(executor.lastHandle(), Instant.parse("2024-01-01T01:00:05Z"), "boom");
    tickAt("2024-01-01T01:00:10Z");

    var run = scheduler.listRuns(schedule.id()).get(0);
    assertEquals(RunStatus.FAILURE, run.status());
    assertEquals(RetryStatus.EXHAUSTED, run.retryStatus());
    verify(webhook, times(1)).send(any(), eq(NotificationTrigger.RUN_FAILED), any());
  }

  @Test
  public void pendingRunRelaunchedWhenCapacityFrees() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);
    executor.setAtCapacity(true);

    tickAt("2024-01-01T01:00:30Z");
    var run = scheduler.listRuns(schedule.id()).get(0);
    assertEquals(0, run.attemptsTotal());
    assertTrue(run.isActive());
    assertEquals(1, store.schedulerEvents("executor_at_capacity").size());

    tickAt("2024-01-01T01:01:00Z");
    assertEquals(0, scheduler.getRun(run.id()).attemptsTotal());
    assertEquals(2, store.schedulerEvents("executor_at_capacity").size());

    executor.setAtCapacity(false);
    tickAt("2024-01-01T01:01:30Z");
    assertEquals(1, scheduler.getRun(run.id()).attemptsTotal());
    assertEquals(1, executor.started().size());

    tickAt("2024-01-01T01:02:00Z");
    assertEquals(1, executor.started().size());
    assertEquals(1, scheduler.listAttempts(run.id()).size());
  }

  @Test
  public void invalidCronStallsSchedule() {
    var schedule =
        scheduler.createSchedule(
            new Schedule("broken", "99 * * * *", "UTC", "dbt run", env.id()));
    assertNull(schedule.nextRunTime());
    assertEquals(1, store.schedulerEvents("invalid_schedule").size());

    tickAt("2024-01-01T05:00:00Z");
    assertTrue(scheduler.listRuns(schedule.id()).isEmpty());
  }

  @Test
  public void unknownTimezoneStallsDueSchedule() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);
    // edited behind the API's back, as a direct table update would
    store.updateSchedule(schedule.withTimezone("Atlantis/Capital"));

    tickAt("2024-01-01T01:00:30Z");

    assertTrue(scheduler.listRuns(schedule.id()).isEmpty());
    assertNull(scheduler.getSchedule(schedule.id()).nextRunTime());
    assertEquals(1, store.schedulerEvents("invalid_schedule").size());

    // correcting the timezone resumes firing
    var fixed = scheduler.updateSchedule(scheduler.getSchedule(schedule.id()).withTimezone("UTC"));
    assertEquals(Instant.parse("2024-01-01T02:00:00Z"), fixed.nextRunTime());
  }

  @Test
  public void pauseAndResume() {
    var schedule = hourly(CatchUpPolicy.CATCH_UP, OverlapPolicy.ALLOW_OVERLAP);
    var paused = scheduler.pauseSchedule(schedule.id());
    assertFalse(paused.enabled());
    assertEquals(ScheduleStatus.PAUSED, paused.status());

    tickAt("2024-01-01T05:30:00Z");
    assertTrue(scheduler.listRuns(schedule.id()).isEmpty());

    var resumed = scheduler.resumeSchedule(schedule.id());
    assertTrue(resumed.enabled());
    assertEquals(Instant.parse("2024-01-01T06:00:00Z"), resumed.nextRunTime());
  }

  @Test
  public void runNowRespectsOverlapPolicy() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);

    var run = scheduler.runNow(schedule.id());
    assertEquals(TriggeringEvent.MANUAL, run.triggeringEvent());
    assertEquals(1, run.attemptsTotal());
    assertEquals(
        "/execution/runs/" + executor.lastHandle() + "/logs", run.logLinks().get("logs"));

    assertThrows(ScheduleOverlapConflictException.class, () -> scheduler.runNow(schedule.id()));

    var allowing =
        scheduler.updateSchedule(
            scheduler.getSchedule(schedule.id()).withOverlapPolicy(OverlapPolicy.ALLOW_OVERLAP));
    scheduler.runNow(allowing.id());
    assertEquals(2, scheduler.listRuns(schedule.id()).size());
  }

  @Test
  public void cancelRun() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);
    var run = scheduler.runNow(schedule.id());

    assertTrue(scheduler.cancelRun(run.id()));
    assertEquals(List.of(executor.lastHandle()), executor.cancelled());

    tickAt("2024-01-01T00:00:30Z");
    var cancelled = scheduler.getRun(run.id());
    assertEquals(RunStatus.CANCELLED, cancelled.status());
    assertTrue(cancelled.isTerminal());
    verify(webhook, times(1)).send(any(), eq(NotificationTrigger.RUN_CANCELLED), any());

    assertFalse(scheduler.cancelRun(run.id()));
  }

  @Test
  public void cancelPendingRunWithoutAttempts() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);
    executor.setAtCapacity(true);
    tickAt("2024-01-01T01:00:30Z");
    var run = scheduler.listRuns(schedule.id()).get(0);
    assertEquals(0, run.attemptsTotal());

    assertTrue(scheduler.cancelRun(run.id()));
    var cancelled = scheduler.getRun(run.id());
    assertEquals(RunStatus.CANCELLED, cancelled.status());
    assertEquals(RetryStatus.EXHAUSTED, cancelled.retryStatus());
    assertEquals(Instant.parse("2024-01-01T01:00:30Z"), cancelled.finishedAt());
    assertTrue(executor.cancelled().isEmpty());
    verify(webhook, times(1)).send(any(), eq(NotificationTrigger.RUN_CANCELLED), any());

    executor.setAtCapacity(false);
    tickAt("2024-01-01T01:01:00Z");
    assertTrue(executor.started().isEmpty());
    assertEquals(0, scheduler.getRun(run.id()).attemptsTotal());
    assertFalse(scheduler.cancelRun(run.id()));
    verify(webhook, times(1)).send(any(), eq(NotificationTrigger.RUN_CANCELLED), any());

    tickAt("2024-01-01T02:00:30Z");
    assertEquals(2, scheduler.listRuns(schedule.id()).size());
    assertEquals(1, executor.started().size());
  }

  @Test
  public void cancelRunWaitingForRetry() {
    var schedule =
        scheduler.updateSchedule(
            hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP)
                .withRetryPolicy(RetryPolicy.fixed(2, 60)));
    tickAt("2024-01-01T01:00:00Z");
    var runId = scheduler.listRuns(schedule.id()).get(0).id();
    executor.fail(executor.lastHandle(), Instant.parse("2024-01-01T01:00:05Z"), "exit code 1");
    tickAt("2024-01-01T01:00:10Z");
    assertEquals(RetryStatus.IN_PROGRESS, scheduler.getRun(runId).retryStatus());

    assertTrue(scheduler.cancelRun(runId));
    assertEquals(RunStatus.CANCELLED, scheduler.getRun(runId).status());

    tickAt("2024-01-01T01:05:00Z");
    assertEquals(1, executor.started().size());
    assertEquals(1, scheduler.getRun(runId).attemptsTotal());
    verify(webhook, never()).send(any(), eq(NotificationTrigger.RUN_FAILED), any());
  }

  @Test
  public void disablingThroughUpdateKeepsNextRunTime() {
    var schedule = hourly(CatchUpPolicy.CATCH_UP, OverlapPolicy.ALLOW_OVERLAP);
    assertEquals(Instant.parse("2024-01-01T01:00:00Z"), schedule.nextRunTime());

    var disabled =
        scheduler.updateSchedule(scheduler.getSchedule(schedule.id()).withEnabled(false));
    assertEquals(ScheduleStatus.PAUSED, disabled.status());
    assertEquals(Instant.parse("2024-01-01T01:00:00Z"), disabled.nextRunTime());
    assertEquals(
        Instant.parse("2024-01-01T01:00:00Z"),
        scheduler.getSchedule(schedule.id()).nextRunTime());

    clock.set(Instant.parse("2024-01-01T03:30:00Z"));
    var enabled =
        scheduler.updateSchedule(scheduler.getSchedule(schedule.id()).withEnabled(true));
    assertEquals(ScheduleStatus.ACTIVE, enabled.status());
    assertEquals(Instant.parse("2024-01-01T04:00:00Z"), enabled.nextRunTime());
  }

  @Test
  public void environmentLifecycle() {
    assertThrows(
        NonExistentEnvironmentException.class,
        () -> scheduler.createSchedule(new Schedule("orphan", "0 * * * *", "UTC", "dbt run", 999L)));

    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);
    assertThrows(IllegalStateException.class, () -> scheduler.deleteEnvironment(env.id()));

    scheduler.deleteSchedule(schedule.id());
    assertThrows(NonExistentScheduleException.class, () -> scheduler.getSchedule(schedule.id()));
    scheduler.deleteEnvironment(env.id());

    var environments = scheduler.listEnvironments();
    assertEquals(1, environments.size());
    assertEquals(Constants.DEFAULT_ENVIRONMENT_NAME, environments.get(0).name());
  }

  @Test
  public void deleteScheduleRemovesRuns() {
    var schedule = hourly(CatchUpPolicy.CATCH_UP, OverlapPolicy.ALLOW_OVERLAP);
    tickAt("2024-01-01T02:30:00Z");
    var runId = scheduler.listRuns(schedule.id()).get(0).id();

    scheduler.deleteSchedule(schedule.id());
    assertTrue(store.getScheduledRun(runId).isEmpty());
    assertTrue(store.listAttempts(runId).isEmpty());
  }

  @Test
  public void overviewAndLogs() {
    var active = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);
    var other =
        scheduler.createSchedule(
            new Schedule("daily-snapshots", "30 2 * * *", "UTC", "dbt snapshot", env.id()));
    scheduler.pauseSchedule(other.id());
    tickAt("2024-01-01T01:00:30Z");

    var overview = scheduler.overview();
    assertFalse(overview.running());
    assertEquals(2, overview.totalSchedules());
    assertEquals(1, overview.activeSchedules());
    assertEquals(1, overview.pausedSchedules());
    assertEquals(1L, overview.runsByStatus().get(RunStatus.SKIPPED));
    assertEquals(1, overview.upcomingRuns().size());
    assertEquals(active.id(), overview.upcomingRuns().get(0).scheduleId());

    var logs = scheduler.logs(active.id(), 10);
    assertFalse(logs.isEmpty());
    assertEquals("attempt_started", logs.get(0).eventType());
    assertTrue(logs.stream().allMatch(e -> active.id().equals(e.scheduleId())));
    assertEquals(2, scheduler.logs(active.id(), 2).size());
  }

  @Test
  public void testNotificationsUsesEnabledChannels() {
    var schedule = hourly(CatchUpPolicy.SKIP, OverlapPolicy.NO_OVERLAP);
    var results = scheduler.testNotifications(schedule.id());
    assertEquals(1, results.size());
    assertEquals(NotificationChannelType.WEBHOOK, results.get(0).channel());
    assertTrue(results.get(0).success());

    var slackOnly =
        scheduler.testNotifications(
            NotificationConfig.empty()
                .withSlack(new SlackChannel("http://slack")));
    assertEquals(1, slackOnly.size());
    assertFalse(slackOnly.get(0).success());
  }

  @Test
  public void launchWithSchedulerDisabledDoesNotStartLoop() {
    scheduler.launch();
    assertFalse(scheduler.isRunning());
    scheduler.shutdown();
    assertFalse(scheduler.isRunning());
  }
}
