package dev.pipeline.scheduler.execution;

import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.RetryPolicy;
import dev.pipeline.scheduler.model.RetryStatus;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.ScheduledRun;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives a scheduled run's aggregate state from its attempts, and decides which notification a
 * change of that state fires.
 */
public final class RunStateMachine {

  private RunStateMachine() {}

  /**
   * Recomputes status, retry status, attempt count, timestamps and links of {@code run} from its
   * attempts. Status and retry status follow the latest attempt:
   *
   * <ul>
   *   <li>queued or running: SKIPPED, retries IN_PROGRESS unless the policy has none
   *   <li>succeeded: SUCCESS; a first-attempt success is NOT_APPLICABLE, a later one keeps the
   *       retry status the run had
   *   <li>cancelled: CANCELLED and EXHAUSTED
   *   <li>failed: FAILURE, EXHAUSTED or IN_PROGRESS depending on the policy
   * </ul>
   */
  public static ScheduledRun derive(
      ScheduledRun run, List<Attempt> attempts, RetryPolicy policy, String linkBaseUrl) {
    if (attempts.isEmpty()) {
      return run.withAttemptsTotal(0).withStatus(RunStatus.SKIPPED);
    }
    var latest = attempts.stream().max(Comparator.comparingInt(Attempt::attemptNumber)).get();
    int attemptsTotal = latest.attemptNumber();

    RunStatus status;
    RetryStatus retryStatus;
    switch (latest.status()) {
      case SUCCEEDED:
        status = RunStatus.SUCCESS;
        retryStatus = attemptsTotal == 1 ? RetryStatus.NOT_APPLICABLE : run.retryStatus();
        break;
      case CANCELLED:
        status = RunStatus.CANCELLED;
        retryStatus = RetryStatus.EXHAUSTED;
        break;
      case FAILED:
        status = RunStatus.FAILURE;
        retryStatus =
            RetryPolicyEngine.isExhausted(policy, attemptsTotal)
                ? RetryStatus.EXHAUSTED
                : RetryStatus.IN_PROGRESS;
        break;
      case QUEUED:
      case RUNNING:
      default:
        status = RunStatus.SKIPPED;
        retryStatus = launchRetryStatus(policy);
        break;
    }

    var links = links(linkBaseUrl, latest.jobHandle());
    return run.withAttemptsTotal(attemptsTotal)
        .withStatus(status)
        .withRetryStatus(retryStatus)
        .withQueuedAt(latest.queuedAt())
        .withStartedAt(latest.startedAt())
        .withFinishedAt(latest.finishedAt())
        .withLinks(links.get(0), links.get(1));
  }

  /** Retry status a run carries while a freshly launched attempt is in flight */
  public static RetryStatus launchRetryStatus(RetryPolicy policy) {
    return policy.maxRetries() == 0 ? RetryStatus.NOT_APPLICABLE : RetryStatus.IN_PROGRESS;
  }

  /**
   * The notification fired by the change from {@code before} to {@code after}, if any. Nothing
   * fires when neither status nor retry status changed. A failure fires only on the change that
   * exhausts the retries.
   */
  public static Optional<NotificationTrigger> transitionTrigger(
      ScheduledRun before, ScheduledRun after) {
    if (before.status() == after.status() && before.retryStatus() == after.retryStatus()) {
      return Optional.empty();
    }
    switch (after.status()) {
      case SUCCESS:
        return before.status() == RunStatus.SUCCESS
            ? Optional.empty()
            : Optional.of(NotificationTrigger.RUN_SUCCEEDED);
      case CANCELLED:
        return before.status() == RunStatus.CANCELLED
            ? Optional.empty()
            : Optional.of(NotificationTrigger.RUN_CANCELLED);
      case FAILURE:
        if (after.retryStatus() == RetryStatus.EXHAUSTED
            && !(before.status() == RunStatus.FAILURE
                && before.retryStatus() == RetryStatus.EXHAUSTED)) {
          return Optional.of(NotificationTrigger.RUN_FAILED);
        }
        return Optional.empty();
      default:
        return Optional.empty();
    }
  }

  /** Marks a failed run as having no retries left */
  public static ScheduledRun markExhausted(ScheduledRun run) {
    return run.withRetryStatus(RetryStatus.EXHAUSTED);
  }

  /**
   * Log links and artifact links of a job, in that order. Both are empty when the job handle is
   * unknown.
   */
  public static List<Map<String, String>> links(String linkBaseUrl, String jobHandle) {
    if (jobHandle == null || jobHandle.isEmpty()) {
      return List.of(Map.of(), Map.of());
    }
    var base = linkBaseUrl == null ? "" : linkBaseUrl;
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    var prefix = base + "/" + jobHandle;
    return List.of(
        Map.of("run_detail", prefix + "/detail", "logs", prefix + "/logs"),
        Map.of("artifacts", prefix + "/artifacts"));
  }
}
