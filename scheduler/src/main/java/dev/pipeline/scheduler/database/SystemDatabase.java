package dev.pipeline.scheduler.database;

import dev.pipeline.scheduler.Constants;
import dev.pipeline.scheduler.config.SchedulerConfig;
import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.Environment;
import dev.pipeline.scheduler.model.NotificationEvent;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduledRun;
import dev.pipeline.scheduler.model.SchedulerEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Postgres-backed {@link LifecycleStore}. Every call is retried on transient SQL failures. */
public class SystemDatabase implements LifecycleStore, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(SystemDatabase.class);

  public static String sanitizeSchema(String schema) {
    schema =
        Objects.requireNonNullElse(schema, Constants.DB_SCHEMA)
            .replace("\0", "")
            .replace("\"", "\"\"");
    return "\"%s\"".formatted(schema);
  }

  private final HikariDataSource dataSource;
  private final String schema;
  private final Clock clock;

  private final EnvironmentDAO environmentDAO;
  private final ScheduleDAO scheduleDAO;
  private final RunsDAO runsDAO;
  private final EventsDAO eventsDAO;

  public SystemDatabase(SchedulerConfig config) {
    this(
        SystemDatabase.createDataSource(Objects.requireNonNull(config)),
        config.schema(),
        Clock.systemUTC());
  }

  public SystemDatabase(HikariDataSource dataSource, String schema, Clock clock) {
    this.schema = sanitizeSchema(schema);
    this.dataSource = dataSource;
    this.clock = Objects.requireNonNull(clock);
    environmentDAO = new EnvironmentDAO(dataSource, this.schema);
    scheduleDAO = new ScheduleDAO(dataSource, this.schema);
    runsDAO = new RunsDAO(dataSource, this.schema);
    eventsDAO = new EventsDAO(dataSource, this.schema);
  }

  @Override
  public void close() {
    logger.debug("Closing scheduler database pool");
    dataSource.close();
  }

  @Override
  public Environment createEnvironment(Environment environment) {
    return DbRetry.callOnce(() -> environmentDAO.create(environment, clock.instant()));
  }

  @Override
  public Optional<Environment> getEnvironment(long environmentId) {
    return DbRetry.call(() -> environmentDAO.get(environmentId));
  }

  @Override
  public Optional<Environment> getEnvironmentByName(String name) {
    return DbRetry.call(() -> environmentDAO.getByName(name));
  }

  @Override
  public List<Environment> listEnvironments() {
    return DbRetry.call(() -> environmentDAO.list());
  }

  @Override
  public Environment updateEnvironment(Environment environment) {
    return DbRetry.call(() -> environmentDAO.update(environment, clock.instant()));
  }

  @Override
  public boolean deleteEnvironment(long environmentId) {
    return DbRetry.call(() -> environmentDAO.delete(environmentId));
  }

  @Override
  public Schedule createSchedule(Schedule schedule) {
    return DbRetry.callOnce(() -> scheduleDAO.create(schedule, clock.instant()));
  }

  @Override
  public Optional<Schedule> getSchedule(long scheduleId) {
    return DbRetry.call(() -> scheduleDAO.get(scheduleId));
  }

  @Override
  public List<Schedule> listSchedules() {
    return DbRetry.call(() -> scheduleDAO.list());
  }

  @Override
  public List<Schedule> listSchedulesForEnvironment(long environmentId) {
    return DbRetry.call(() -> scheduleDAO.listForEnvironment(environmentId));
  }

  @Override
  public Schedule updateSchedule(Schedule schedule) {
    return DbRetry.call(() -> scheduleDAO.update(schedule, clock.instant()));
  }

  @Override
  public boolean deleteSchedule(long scheduleId) {
    return DbRetry.call(() -> scheduleDAO.delete(scheduleId));
  }

  @Override
  public List<Schedule> findDueSchedules(Instant now) {
    return DbRetry.call(() -> scheduleDAO.findDue(now));
  }

  @Override
  public void advanceSchedule(long scheduleId, Instant nextRunTime, Instant lastRunTime) {
    DbRetry.run(() -> scheduleDAO.advance(scheduleId, nextRunTime, lastRunTime, clock.instant()));
  }

  @Override
  public Optional<ScheduledRun> createScheduledRun(ScheduledRun run, boolean requireNoActiveRun) {
    return DbRetry.callOnce(() -> runsDAO.create(run, requireNoActiveRun));
  }

  @Override
  public Optional<ScheduledRun> getScheduledRun(long runId) {
    return DbRetry.call(() -> runsDAO.get(runId));
  }

  @Override
  public List<ScheduledRun> listRunsForSchedule(long scheduleId) {
    return DbRetry.call(() -> runsDAO.listForSchedule(scheduleId));
  }

  @Override
  public List<ScheduledRun> listRunsForEnvironment(long environmentId) {
    return DbRetry.call(() -> runsDAO.listForEnvironment(environmentId));
  }

  @Override
  public List<ScheduledRun> findRetryCandidates() {
    return DbRetry.call(() -> runsDAO.findRetryCandidates());
  }

  @Override
  public List<ScheduledRun> findPendingLaunches() {
    return DbRetry.call(() -> runsDAO.findPendingLaunches());
  }

  @Override
  public void updateScheduledRun(ScheduledRun run) {
    DbRetry.run(() -> runsDAO.update(run));
  }

  @Override
  public boolean deleteScheduledRun(long runId) {
    return DbRetry.call(() -> runsDAO.delete(runId));
  }

  @Override
  public Map<RunStatus, Long> countRunsByStatus() {
    return DbRetry.call(() -> runsDAO.countByStatus());
  }

  @Override
  public Attempt recordAttempt(ScheduledRun launched, Attempt attempt) {
    return DbRetry.callOnce(() -> runsDAO.recordAttempt(launched, attempt));
  }

  @Override
  public List<Attempt> listAttempts(long runId) {
    return DbRetry.call(() -> runsDAO.listAttempts(runId));
  }

  @Override
  public List<Attempt> findActiveAttempts() {
    return DbRetry.call(() -> runsDAO.findActiveAttempts());
  }

  @Override
  public void saveAttemptAndRun(Attempt attempt, ScheduledRun run) {
    DbRetry.run(() -> runsDAO.saveAttemptAndRun(attempt, run));
  }

  @Override
  public void recordSchedulerEvent(SchedulerEvent event) {
    DbRetry.runOnce(() -> eventsDAO.recordSchedulerEvent(event));
  }

  @Override
  public List<SchedulerEvent> listSchedulerEvents(Long scheduleId, int limit) {
    return DbRetry.call(() -> eventsDAO.listSchedulerEvents(scheduleId, limit));
  }

  @Override
  public void recordNotificationEvent(NotificationEvent event) {
    DbRetry.runOnce(() -> eventsDAO.recordNotificationEvent(event));
  }

  @Override
  public List<NotificationEvent> listNotificationEvents(long runId) {
    return DbRetry.call(() -> eventsDAO.listNotificationEvents(runId));
  }

  public static HikariDataSource createDataSource(SchedulerConfig config) {
    if (config.dataSource() != null) {
      return config.dataSource();
    }
    var dburl = config.databaseUrl();
    var dbUser = config.dbUser();
    var dbPassword = config.dbPassword();
    if (dburl == null || dburl.isEmpty()) {
      throw new IllegalArgumentException("SchedulerConfig.databaseUrl must be set");
    }
    return createDataSource(
        dburl, dbUser, dbPassword, config.maximumPoolSize(), config.connectionTimeout());
  }

  public static HikariDataSource createDataSource(String url, String user, String password) {
    return createDataSource(url, user, password, 0, 0);
  }

  public static HikariDataSource createDataSource(
      String url, String user, String password, int poolSize, int timeout) {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(url);
    hikariConfig.setUsername(user);
    hikariConfig.setPassword(password);
    hikariConfig.setMaximumPoolSize(poolSize > 0 ? poolSize : 2);
    if (timeout > 0) {
      hikariConfig.setConnectionTimeout(timeout);
    }

    return new HikariDataSource(hikariConfig);
  }
}
