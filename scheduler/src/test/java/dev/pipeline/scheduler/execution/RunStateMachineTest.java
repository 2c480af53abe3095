package dev.pipeline.scheduler.execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.AttemptStatus;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.RetryPolicy;
import dev.pipeline.scheduler.model.RetryStatus;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.ScheduledRun;
import dev.pipeline.scheduler.model.TriggeringEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

class RunStateMachineTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final String BASE = "https://ops.example.com/execution/runs/";

  private static ScheduledRun run() {
    return ScheduledRun.pending(1L, TriggeringEvent.CRON, T0, Map.of(), "dbt run").withId(7L);
  }

  private static Attempt attempt(int number, AttemptStatus status) {
    var finished = status.isTerminal() ? T0.plusSeconds(60L * number) : null;
    return new Attempt(
        (long) number, 7L, number, "job-" + number, status, T0, T0, finished, null);
  }

  @Test
  public void noAttemptsIsPending() {
    var derived = RunStateMachine.derive(run(), List.of(), RetryPolicy.none(), BASE);
    assertEquals(RunStatus.SKIPPED, derived.status());
    assertEquals(0, derived.attemptsTotal());
    assertTrue(derived.isActive());
  }

  @Test
  public void firstAttemptSuccess() {
    var derived =
        RunStateMachine.derive(
            run(), List.of(attempt(1, AttemptStatus.SUCCEEDED)), RetryPolicy.fixed(2, 10), BASE);
    assertEquals(RunStatus.SUCCESS, derived.status());
    assertEquals(RetryStatus.NOT_APPLICABLE, derived.retryStatus());
    assertEquals(1, derived.attemptsTotal());
    assertEquals(T0.plusSeconds(60), derived.finishedAt());
    assertTrue(derived.isTerminal());
  }

  @Test
  public void linksFollowLatestJob() {
    var derived =
        RunStateMachine.derive(
            run(),
            List.of(attempt(1, AttemptStatus.FAILED), attempt(2, AttemptStatus.RUNNING)),
            RetryPolicy.fixed(2, 10),
            BASE);
    assertEquals(
        Map.of(
            "run_detail", "https://ops.example.com/execution/runs/job-2/detail",
            "logs", "https://ops.example.com/execution/runs/job-2/logs"),
        derived.logLinks());
    assertEquals(
        Map.of("artifacts", "https://ops.example.com/execution/runs/job-2/artifacts"),
        derived.artifactLinks());
    assertEquals(RunStatus.SKIPPED, derived.status());
    assertEquals(RetryStatus.IN_PROGRESS, derived.retryStatus());
    assertEquals(2, derived.attemptsTotal());
  }

  @Test
  public void failureWithRetriesLeftStaysActive() {
    var derived =
        RunStateMachine.derive(
            run(), List.of(attempt(1, AttemptStatus.FAILED)), RetryPolicy.fixed(2, 10), BASE);
    assertEquals(RunStatus.FAILURE, derived.status());
    assertEquals(RetryStatus.IN_PROGRESS, derived.retryStatus());
    assertTrue(derived.isActive());
  }

  @Test
  public void failureWithoutRetriesIsExhausted() {
    var derived =
        RunStateMachine.derive(
            run(), List.of(attempt(1, AttemptStatus.FAILED)), RetryPolicy.none(), BASE);
    assertEquals(RunStatus.FAILURE, derived.status());
    assertEquals(RetryStatus.EXHAUSTED, derived.retryStatus());
    assertTrue(derived.isTerminal());
  }

  @Test
  public void cancellationIsTerminal() {
    var derived =
        RunStateMachine.derive(
            run(), List.of(attempt(1, AttemptStatus.CANCELLED)), RetryPolicy.fixed(3, 10), BASE);
    assertEquals(RunStatus.CANCELLED, derived.status());
    assertEquals(RetryStatus.EXHAUSTED, derived.retryStatus());
    assertTrue(derived.isTerminal());
  }

  @Test
  public void failedTriggerFiresOnlyOnExhaustion() {
    var running = run().withStatus(RunStatus.SKIPPED).withRetryStatus(RetryStatus.IN_PROGRESS);
    var retrying = running.withStatus(RunStatus.FAILURE);
    var exhausted = retrying.withRetryStatus(RetryStatus.EXHAUSTED);

    assertEquals(Optional.empty(), RunStateMachine.transitionTrigger(running, retrying));
    assertEquals(
        Optional.of(NotificationTrigger.RUN_FAILED),
        RunStateMachine.transitionTrigger(retrying, exhausted));
    assertEquals(
        Optional.of(NotificationTrigger.RUN_FAILED),
        RunStateMachine.transitionTrigger(running, exhausted));
    assertEquals(Optional.empty(), RunStateMachine.transitionTrigger(exhausted, exhausted));
    assertEquals(exhausted, RunStateMachine.markExhausted(retrying));
  }

  @Test
  public void successAndCancelTriggers() {
    var running = run().withRetryStatus(RetryStatus.NOT_APPLICABLE);
    var success = running.withStatus(RunStatus.SUCCESS);
    var cancelled = running.withStatus(RunStatus.CANCELLED).withRetryStatus(RetryStatus.EXHAUSTED);

    assertEquals(
        Optional.of(NotificationTrigger.RUN_SUCCEEDED),
        RunStateMachine.transitionTrigger(running, success));
    assertEquals(
        Optional.of(NotificationTrigger.RUN_CANCELLED),
        RunStateMachine.transitionTrigger(running, cancelled));
    assertEquals(Optional.empty(), RunStateMachine.transitionTrigger(success, success));
  }

  @Test
  public void noLinksWithoutJobHandle() {
    var links = RunStateMachine.links(BASE, null);
    assertTrue(links.get(0).isEmpty());
    assertTrue(links.get(1).isEmpty());
  }
}
