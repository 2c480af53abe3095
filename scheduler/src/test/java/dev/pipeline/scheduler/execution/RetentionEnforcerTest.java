package dev.pipeline.scheduler.execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pipeline.scheduler.model.Environment;
import dev.pipeline.scheduler.model.RetentionAction;
import dev.pipeline.scheduler.model.RetentionPolicy;
import dev.pipeline.scheduler.model.RetentionScope;
import dev.pipeline.scheduler.model.RetryStatus;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduledRun;
import dev.pipeline.scheduler.model.TriggeringEvent;
import dev.pipeline.scheduler.utils.InMemoryLifecycleStore;
import dev.pipeline.scheduler.utils.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RetentionEnforcerTest {

  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

  private InMemoryLifecycleStore store;
  private RetentionEnforcer enforcer;
  private Environment env;

  @BeforeEach
  void beforeEachTest() {
    var clock = new MutableClock(NOW);
    store = new InMemoryLifecycleStore(clock);
    enforcer = new RetentionEnforcer(store, new SchedulerEventLog(store, clock));
    env = store.createEnvironment(new Environment("prod"));
  }

  private Schedule schedule(String name) {
    return store.createSchedule(new Schedule(name, "0 * * * *", "UTC", "dbt build", env.id()));
  }

  private ScheduledRun finishedRun(Schedule schedule, Instant scheduledAt, RunStatus status) {
    var run =
        store
            .createScheduledRun(
                ScheduledRun.pending(
                    schedule.id(), TriggeringEvent.CRON, scheduledAt, Map.of(), "dbt build"),
                false)
            .orElseThrow();
    var finished =
        run.withStatus(status)
            .withRetryStatus(
                status == RunStatus.SUCCESS ? RetryStatus.NOT_APPLICABLE : RetryStatus.EXHAUSTED)
            .withAttemptsTotal(1)
            .withFinishedAt(scheduledAt.plusSeconds(300))
            .withLinks(
                Map.of("logs", "/execution/runs/job/logs"),
                Map.of("artifacts", "/execution/runs/job/artifacts"));
    store.updateScheduledRun(finished);
    return finished;
  }

  private static Instant daysAgo(int days, int hours) {
    return NOW.minus(Duration.ofDays(days)).minus(Duration.ofHours(hours));
  }

  @Test
  public void keepsNewestRunsRegardlessOfAge() {
    var schedule = schedule("nightly");
    List<ScheduledRun> oldest = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      oldest.add(finishedRun(schedule, daysAgo(40, i), RunStatus.SUCCESS));
    }
    List<ScheduledRun> newest = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      newest.add(finishedRun(schedule, daysAgo(35, -i - 1), RunStatus.FAILURE));
    }

    var policy = new RetentionPolicy(5, 30, RetentionAction.DELETE);
    assertEquals(5, enforcer.apply(schedule, policy, NOW));

    var remaining =
        store.listRunsForSchedule(schedule.id()).stream()
            .map(ScheduledRun::id)
            .collect(Collectors.toSet());
    assertEquals(5, remaining.size());
    assertTrue(newest.stream().allMatch(r -> remaining.contains(r.id())));
    assertTrue(oldest.stream().noneMatch(r -> remaining.contains(r.id())));
    assertEquals(5, store.schedulerEvents("retention_deleted").size());
  }

  @Test
  public void runMustBeOlderThanCutoff() {
    var schedule = schedule("nightly");
    for (int i = 0; i < 4; i++) {
      finishedRun(schedule, daysAgo(10, i), RunStatus.SUCCESS);
    }
    finishedRun(schedule, daysAgo(31, 0), RunStatus.SUCCESS);

    var policy = new RetentionPolicy(2, 30, RetentionAction.DELETE);
    assertEquals(1, enforcer.apply(schedule, policy, NOW));
    assertEquals(4, store.listRunsForSchedule(schedule.id()).size());
  }

  @Test
  public void activeRunsAreNeverTouched() {
    var schedule = schedule("nightly");
    var pending =
        store
            .createScheduledRun(
                ScheduledRun.pending(
                    schedule.id(), TriggeringEvent.CRON, daysAgo(90, 0), Map.of(), "dbt build"),
                false)
            .orElseThrow();
    var retrying =
        finishedRun(schedule, daysAgo(80, 0), RunStatus.FAILURE)
            .withRetryStatus(RetryStatus.IN_PROGRESS);
    store.updateScheduledRun(retrying);
    var done = finishedRun(schedule, daysAgo(70, 0), RunStatus.CANCELLED);

    var policy = new RetentionPolicy(null, 30, RetentionAction.DELETE);
    assertEquals(1, enforcer.apply(schedule, policy, NOW));

    assertTrue(store.getScheduledRun(pending.id()).isPresent());
    assertTrue(store.getScheduledRun(retrying.id()).isPresent());
    assertFalse(store.getScheduledRun(done.id()).isPresent());
  }

  @Test
  public void archiveClearsLinksOnce() {
    var schedule = schedule("nightly");
    var old = finishedRun(schedule, daysAgo(60, 0), RunStatus.SUCCESS);
    finishedRun(schedule, daysAgo(1, 0), RunStatus.SUCCESS);

    var policy = new RetentionPolicy(1, null, RetentionAction.ARCHIVE);
    assertEquals(1, enforcer.apply(schedule, policy, NOW));

    var archived = store.getScheduledRun(old.id()).orElseThrow();
    assertTrue(archived.logLinks().isEmpty());
    assertTrue(archived.artifactLinks().isEmpty());
    assertEquals(RunStatus.SUCCESS, archived.status());

    assertEquals(0, enforcer.apply(schedule, policy, NOW));
    assertEquals(1, store.schedulerEvents("retention_archived").size());
  }

  @Test
  public void environmentDefaultAppliesAcrossSchedules() {
    env =
        store.updateEnvironment(
            env.withDefaultRetentionPolicy(
                new RetentionPolicy(3, null, RetentionAction.DELETE)
                    .withScope(RetentionScope.PER_ENVIRONMENT)));
    var first = schedule("first");
    var second = schedule("second");
    for (int i = 0; i < 3; i++) {
      finishedRun(first, daysAgo(5, i * 2), RunStatus.SUCCESS);
      finishedRun(second, daysAgo(5, i * 2 + 1), RunStatus.SUCCESS);
    }

    assertEquals(3, enforcer.applyAll(NOW));
    assertEquals(3, store.listRunsForEnvironment(env.id()).size());
    assertEquals(2, store.listRunsForSchedule(first.id()).size());
    assertEquals(1, store.listRunsForSchedule(second.id()).size());
  }

  @Test
  public void schedulePolicyOverridesEnvironmentDefault() {
    env =
        store.updateEnvironment(
            env.withDefaultRetentionPolicy(new RetentionPolicy(1, null, RetentionAction.DELETE)));
    var keepAll =
        store.updateSchedule(
            schedule("keep-all")
                .withRetentionPolicy(new RetentionPolicy(10, null, RetentionAction.DELETE)));
    var usesDefault = schedule("uses-default");
    for (int i = 0; i < 3; i++) {
      finishedRun(keepAll, daysAgo(2, i), RunStatus.SUCCESS);
      finishedRun(usesDefault, daysAgo(2, i), RunStatus.SUCCESS);
    }

    assertEquals(2, enforcer.applyAll(NOW));
    assertEquals(3, store.listRunsForSchedule(keepAll.id()).size());
    assertEquals(1, store.listRunsForSchedule(usesDefault.id()).size());
  }

  @Test
  public void noPolicyNoAction() {
    var schedule = schedule("nightly");
    finishedRun(schedule, daysAgo(400, 0), RunStatus.SUCCESS);
    assertEquals(0, enforcer.applyAll(NOW));
    assertEquals(1, store.listRunsForSchedule(schedule.id()).size());
  }
}
