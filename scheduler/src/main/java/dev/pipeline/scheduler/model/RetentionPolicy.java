package dev.pipeline.scheduler.model;

/**
 * Rules for pruning terminal scheduled runs. A run is acted on only when neither rule keeps it.
 *
 * @param scope PER_SCHEDULE applies the rules to each schedule's runs, PER_ENVIRONMENT to all runs
 *     of the environment's schedules taken together
 * @param keepLastNRuns newest runs always kept, or null
 * @param keepForNDays runs younger than this are always kept, or null
 * @param action what happens to a run no rule keeps
 */
public record RetentionPolicy(
    RetentionScope scope, Integer keepLastNRuns, Integer keepForNDays, RetentionAction action) {

  public RetentionPolicy {
    if (scope == null) {
      scope = RetentionScope.PER_SCHEDULE;
    }
    if (action == null) {
      action = RetentionAction.ARCHIVE;
    }
    if (keepLastNRuns != null && keepLastNRuns < 0) {
      throw new IllegalArgumentException("RetentionPolicy.keepLastNRuns must not be negative");
    }
    if (keepForNDays != null && keepForNDays < 0) {
      throw new IllegalArgumentException("RetentionPolicy.keepForNDays must not be negative");
    }
  }

  public RetentionPolicy(Integer keepLastNRuns, Integer keepForNDays, RetentionAction action) {
    this(RetentionScope.PER_SCHEDULE, keepLastNRuns, keepForNDays, action);
  }

  public RetentionPolicy withScope(RetentionScope scope) {
    return new RetentionPolicy(scope, keepLastNRuns, keepForNDays, action);
  }
}
