package dev.pipeline.scheduler.database;

import dev.pipeline.scheduler.exceptions.AttemptConflictException;
import dev.pipeline.scheduler.exceptions.NonExistentEnvironmentException;
import dev.pipeline.scheduler.exceptions.NonExistentRunException;
import dev.pipeline.scheduler.exceptions.NonExistentScheduleException;
import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.Environment;
import dev.pipeline.scheduler.model.NotificationEvent;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduledRun;
import dev.pipeline.scheduler.model.SchedulerEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transactional storage of environments, schedules, runs, attempts and the two event logs. Every
 * method is a single transaction.
 */
public interface LifecycleStore {

  // Environments

  Environment createEnvironment(Environment environment);

  Optional<Environment> getEnvironment(long environmentId);

  Optional<Environment> getEnvironmentByName(String name);

  List<Environment> listEnvironments();

  /**
   * @throws NonExistentEnvironmentException if no environment has the given id
   */
  Environment updateEnvironment(Environment environment);

  boolean deleteEnvironment(long environmentId);

  // Schedules

  Schedule createSchedule(Schedule schedule);

  Optional<Schedule> getSchedule(long scheduleId);

  List<Schedule> listSchedules();

  List<Schedule> listSchedulesForEnvironment(long environmentId);

  /**
   * @throws NonExistentScheduleException if no schedule has the given id
   */
  Schedule updateSchedule(Schedule schedule);

  /** Deletes the schedule with its runs, attempts and notification events */
  boolean deleteSchedule(long scheduleId);

  /** Enabled schedules whose next run time is at or before {@code now}, earliest first */
  List<Schedule> findDueSchedules(Instant now);

  /**
   * Persists the cron state of a schedule. A null {@code lastRunTime} leaves the stored value
   * unchanged.
   */
  void advanceSchedule(long scheduleId, Instant nextRunTime, Instant lastRunTime);

  // Runs

  /**
   * Inserts a run. When {@code requireNoActiveRun} is set the owning schedule is locked and the
   * insert only happens if none of its runs is active.
   *
   * @return the stored run, or empty if an active run blocked the insert
   * @throws NonExistentScheduleException if the owning schedule does not exist
   */
  Optional<ScheduledRun> createScheduledRun(ScheduledRun run, boolean requireNoActiveRun);

  Optional<ScheduledRun> getScheduledRun(long runId);

  /** Runs of one schedule, newest first */
  List<ScheduledRun> listRunsForSchedule(long scheduleId);

  /** Runs of every schedule of one environment, newest first */
  List<ScheduledRun> listRunsForEnvironment(long environmentId);

  /** Runs whose retry status is IN_PROGRESS */
  List<ScheduledRun> findRetryCandidates();

  /** Runs that were created but never got an attempt started */
  List<ScheduledRun> findPendingLaunches();

  /**
   * @throws NonExistentRunException if no run has the given id
   */
  void updateScheduledRun(ScheduledRun run);

  /** Deletes the run with its attempts and notification events */
  boolean deleteScheduledRun(long runId);

  Map<RunStatus, Long> countRunsByStatus();

  // Attempts

  /**
   * Inserts {@code attempt} and stores {@code launched}, whose attempt count must equal the new
   * attempt's number. The run is only written if its stored attempt count is one less and it has
   * not been cancelled.
   *
   * @throws AttemptConflictException if another attempt got that number first, or the run was
   *     cancelled before the attempt was recorded
   * @throws NonExistentRunException if the run does not exist
   */
  Attempt recordAttempt(ScheduledRun launched, Attempt attempt);

  /** Attempts of one run, by attempt number */
  List<Attempt> listAttempts(long runId);

  /** Attempts that are neither succeeded, failed nor cancelled */
  List<Attempt> findActiveAttempts();

  /** Updates an attempt and its run together */
  void saveAttemptAndRun(Attempt attempt, ScheduledRun run);

  // Event logs

  void recordSchedulerEvent(SchedulerEvent event);

  /** Newest first; a null schedule id lists every event */
  List<SchedulerEvent> listSchedulerEvents(Long scheduleId, int limit);

  void recordNotificationEvent(NotificationEvent event);

  List<NotificationEvent> listNotificationEvents(long runId);
}
