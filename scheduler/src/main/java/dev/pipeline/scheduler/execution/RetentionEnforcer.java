package dev.pipeline.scheduler.execution;

import dev.pipeline.scheduler.database.LifecycleStore;
import dev.pipeline.scheduler.model.Environment;
import dev.pipeline.scheduler.model.EventLevel;
import dev.pipeline.scheduler.model.RetentionAction;
import dev.pipeline.scheduler.model.RetentionPolicy;
import dev.pipeline.scheduler.model.RetentionScope;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduledRun;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Archives or deletes old terminal runs according to retention policies. */
public class RetentionEnforcer {

  private static final Logger logger = LoggerFactory.getLogger(RetentionEnforcer.class);

  private final LifecycleStore store;
  private final SchedulerEventLog eventLog;

  public RetentionEnforcer(LifecycleStore store, SchedulerEventLog eventLog) {
    this.store = store;
    this.eventLog = eventLog;
  }

  /**
   * Applies each schedule's retention policy, or its environment's default when it has none.
   * Environment-scoped policies are applied once per environment.
   *
   * @return number of runs archived or deleted
   */
  public int applyAll(Instant now) {
    int affected = 0;
    Map<Long, Optional<Environment>> environments = new HashMap<>();
    Set<Long> environmentsDone = new HashSet<>();
    for (var schedule : store.listSchedules()) {
      try {
        var environment =
            environments.computeIfAbsent(schedule.environmentId(), store::getEnvironment);
        var policy = effectivePolicy(schedule, environment.orElse(null));
        if (policy == null) {
          continue;
        }
        if (policy.scope() == RetentionScope.PER_ENVIRONMENT) {
          if (environment.isPresent() && environmentsDone.add(schedule.environmentId())) {
            affected += applyToEnvironment(environment.get(), policy, now);
          }
        } else {
          affected += apply(schedule, policy, now);
        }
      } catch (RuntimeException e) {
        logger.error("Retention failed for schedule {}", schedule.id(), e);
      }
    }
    return affected;
  }

  static RetentionPolicy effectivePolicy(Schedule schedule, Environment environment) {
    if (schedule.retentionPolicy() != null) {
      return schedule.retentionPolicy();
    }
    return environment == null ? null : environment.defaultRetentionPolicy();
  }

  /** Applies {@code policy} to the runs of one schedule */
  public int apply(Schedule schedule, RetentionPolicy policy, Instant now) {
    return act(selectRuns(store.listRunsForSchedule(schedule.id()), policy, now), policy);
  }

  /** Applies {@code policy} to the runs of every schedule of one environment, taken together */
  public int applyToEnvironment(Environment environment, RetentionPolicy policy, Instant now) {
    return act(selectRuns(store.listRunsForEnvironment(environment.id()), policy, now), policy);
  }

  /**
   * The runs {@code policy} acts on, from runs ordered newest first. A run is selected only if it
   * is outside the newest {@code keepLastNRuns}, was scheduled more than {@code keepForNDays} ago,
   * and is terminal.
   */
  static List<ScheduledRun> selectRuns(
      List<ScheduledRun> newestFirst, RetentionPolicy policy, Instant now) {
    var candidates = newestFirst.stream();
    if (policy.keepLastNRuns() != null && policy.keepLastNRuns() > 0) {
      candidates = candidates.skip(policy.keepLastNRuns());
    }
    if (policy.keepForNDays() != null && policy.keepForNDays() > 0) {
      var cutoff = now.minus(Duration.ofDays(policy.keepForNDays()));
      candidates = candidates.filter(r -> reference(r, now).isBefore(cutoff));
    }
    return candidates.filter(ScheduledRun::isTerminal).collect(Collectors.toList());
  }

  private static Instant reference(ScheduledRun run, Instant now) {
    if (run.scheduledAt() != null) {
      return run.scheduledAt();
    }
    return run.finishedAt() != null ? run.finishedAt() : now;
  }

  private int act(List<ScheduledRun> runs, RetentionPolicy policy) {
    int affected = 0;
    for (var run : runs) {
      if (policy.action() == RetentionAction.DELETE) {
        if (store.deleteScheduledRun(run.id())) {
          affected++;
          eventLog.record(
              EventLevel.INFO,
              run.scheduleId(),
              run.id(),
              "retention_deleted",
              "Scheduled run deleted by retention policy",
              Map.of());
        }
      } else {
        if (run.logLinks().isEmpty() && run.artifactLinks().isEmpty()) {
          continue;
        }
        store.updateScheduledRun(run.withLinks(Map.of(), Map.of()));
        affected++;
        eventLog.record(
            EventLevel.INFO,
            run.scheduleId(),
            run.id(),
            "retention_archived",
            "Scheduled run archived by retention policy",
            Map.of());
      }
    }
    if (affected > 0) {
      logger.info("Retention {} applied to {} runs", policy.action(), affected);
    }
    return affected;
  }
}
