package dev.pipeline.scheduler.execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pipeline.scheduler.executor.LaunchParameters;
import dev.pipeline.scheduler.model.Environment;
import dev.pipeline.scheduler.model.RetryStatus;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduledRun;
import dev.pipeline.scheduler.model.TriggeringEvent;
import dev.pipeline.scheduler.notifications.NotificationDispatcher;
import dev.pipeline.scheduler.utils.FakeJobExecutor;
import dev.pipeline.scheduler.utils.InMemoryLifecycleStore;
import dev.pipeline.scheduler.utils.MutableClock;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttemptLauncherTest {

  private MutableClock clock;
  private InMemoryLifecycleStore store;
  private ScheduledRun run;

  @BeforeEach
  void beforeEachTest() {
    clock = MutableClock.at("2024-01-01T00:00:00Z");
    store = new InMemoryLifecycleStore(clock);
    var env = store.createEnvironment(new Environment("prod"));
    var schedule =
        store.createSchedule(new Schedule("nightly", "0 2 * * *", "UTC", "dbt build", env.id()));
    run =
        store
            .createScheduledRun(
                ScheduledRun.pending(
                    schedule.id(), TriggeringEvent.MANUAL, clock.instant(), Map.of(), "dbt build"),
                true)
            .orElseThrow();
  }

  private AttemptLauncher launcher(FakeJobExecutor executor) {
    var dispatcher = new NotificationDispatcher(store, List.of(), Runnable::run, clock);
    return new AttemptLauncher(
        store,
        executor,
        dispatcher,
        new SchedulerEventLog(store, clock),
        Runnable::run,
        clock,
        "/execution/runs/");
  }

  private ScheduledRun cancelled(ScheduledRun run) {
    return run.withStatus(RunStatus.CANCELLED)
        .withRetryStatus(RetryStatus.EXHAUSTED)
        .withFinishedAt(clock.instant());
  }

  @Test
  public void launchesPendingRun() {
    var executor = new FakeJobExecutor();
    var attempt = launcher(executor).startAttempt(run);

    assertTrue(attempt.isPresent());
    assertEquals(1, attempt.get().attemptNumber());
    assertEquals(1, store.getScheduledRun(run.id()).orElseThrow().attemptsTotal());
  }

  @Test
  public void cancelledRunIsNotLaunched() {
    store.updateScheduledRun(cancelled(run));
    var executor = new FakeJobExecutor();

    assertFalse(launcher(executor).startAttempt(run).isPresent());
    assertTrue(executor.started().isEmpty());
    assertEquals(RunStatus.CANCELLED, store.getScheduledRun(run.id()).orElseThrow().status());
  }

  @Test
  public void cancelDuringLaunchCancelsStartedJob() {
    var executor =
        new FakeJobExecutor() {
          @Override
          public synchronized String startJob(String command, LaunchParameters parameters) {
            var handle = super.startJob(command, parameters);
            store.updateScheduledRun(AttemptLauncherTest.this.cancelled(run));
            return handle;
          }
        };

    assertFalse(launcher(executor).startAttempt(run).isPresent());
    assertEquals(List.of(executor.lastHandle()), executor.cancelled());
    assertTrue(store.listAttempts(run.id()).isEmpty());
    var stored = store.getScheduledRun(run.id()).orElseThrow();
    assertEquals(RunStatus.CANCELLED, stored.status());
    assertEquals(0, stored.attemptsTotal());
  }
}
