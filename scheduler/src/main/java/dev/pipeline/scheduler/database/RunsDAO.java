package dev.pipeline.scheduler.database;

import static dev.pipeline.scheduler.database.SqlTypes.getEnum;
import static dev.pipeline.scheduler.database.SqlTypes.getInstant;
import static dev.pipeline.scheduler.database.SqlTypes.name;
import static dev.pipeline.scheduler.database.SqlTypes.setInstant;

import dev.pipeline.scheduler.exceptions.AttemptConflictException;
import dev.pipeline.scheduler.exceptions.NonExistentRunException;
import dev.pipeline.scheduler.exceptions.NonExistentScheduleException;
import dev.pipeline.scheduler.json.JSONUtil;
import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.AttemptStatus;
import dev.pipeline.scheduler.model.RetryStatus;
import dev.pipeline.scheduler.model.RunStatus;
import dev.pipeline.scheduler.model.ScheduledRun;
import dev.pipeline.scheduler.model.TriggeringEvent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Scheduled runs and their attempts. */
class RunsDAO {
  private static final Logger logger = LoggerFactory.getLogger(RunsDAO.class);

  // Runs matching this predicate are active; every other run is terminal
  static final String ACTIVE_RUN =
      "(status = 'SKIPPED' OR (status = 'FAILURE' AND retry_status = 'IN_PROGRESS'))";

  private final HikariDataSource dataSource;
  private final String schema;

  RunsDAO(HikariDataSource ds, String schema) {
    this.dataSource = ds;
    this.schema = Objects.requireNonNull(schema);
  }

  Optional<ScheduledRun> create(ScheduledRun run, boolean requireNoActiveRun)
      throws SQLException {
    try (Connection connection = dataSource.getConnection()) {
      connection.setAutoCommit(false);
      try {
        var lockSql = "SELECT id FROM %s.schedules WHERE id = ? FOR UPDATE".formatted(schema);
        try (PreparedStatement ps = connection.prepareStatement(lockSql)) {
          ps.setLong(1, run.scheduleId());
          try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
              connection.rollback();
              throw new NonExistentScheduleException(run.scheduleId());
            }
          }
        }

        if (requireNoActiveRun) {
          var activeSql =
              "SELECT id FROM %s.scheduled_runs WHERE schedule_id = ? AND %s LIMIT 1"
                  .formatted(schema, ACTIVE_RUN);
          try (PreparedStatement ps = connection.prepareStatement(activeSql)) {
            ps.setLong(1, run.scheduleId());
            try (ResultSet rs = ps.executeQuery()) {
              if (rs.next()) {
                logger.debug(
                    "Schedule {} has active run {}, not creating another",
                    run.scheduleId(),
                    rs.getLong(1));
                connection.rollback();
                return Optional.empty();
              }
            }
          }
        }

        var insertSql =
            """
            INSERT INTO %s.scheduled_runs
              (schedule_id, triggering_event, status, retry_status, attempts_total, scheduled_at,
               queued_at, started_at, finished_at, environment_snapshot, command, log_links,
               artifact_links)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """
                .formatted(schema);
        long id;
        try (PreparedStatement ps = connection.prepareStatement(insertSql)) {
          ps.setLong(1, run.scheduleId());
          ps.setString(2, name(run.triggeringEvent()));
          ps.setString(3, name(run.status()));
          ps.setString(4, name(run.retryStatus()));
          ps.setInt(5, run.attemptsTotal());
          setInstant(ps, 6, run.scheduledAt());
          setInstant(ps, 7, run.queuedAt());
          setInstant(ps, 8, run.startedAt());
          setInstant(ps, 9, run.finishedAt());
          ps.setString(10, JSONUtil.toJson(run.environmentSnapshot()));
          ps.setString(11, run.command());
          ps.setString(12, JSONUtil.toJson(run.logLinks()));
          ps.setString(13, JSONUtil.toJson(run.artifactLinks()));
          try (ResultSet rs = ps.executeQuery()) {
            rs.next();
            id = rs.getLong(1);
          }
        }
        connection.commit();
        return Optional.of(run.withId(id));
      } catch (SQLException e) {
        connection.rollback();
        throw e;
      }
    }
  }

  Optional<ScheduledRun> get(long id) throws SQLException {
    var runs = queryRuns("SELECT * FROM %s.scheduled_runs WHERE id = ?".formatted(schema), id);
    return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(0));
  }

  List<ScheduledRun> listForSchedule(long scheduleId) throws SQLException {
    var sql =
        """
        SELECT * FROM %s.scheduled_runs
        WHERE schedule_id = ?
        ORDER BY scheduled_at DESC, id DESC
        """
            .formatted(schema);
    return queryRuns(sql, scheduleId);
  }

  List<ScheduledRun> listForEnvironment(long environmentId) throws SQLException {
    var sql =
        """
        SELECT r.* FROM %1$s.scheduled_runs r
        JOIN %1$s.schedules s ON s.id = r.schedule_id
        WHERE s.environment_id = ?
        ORDER BY r.scheduled_at DESC, r.id DESC
        """
            .formatted(schema);
    return queryRuns(sql, environmentId);
  }

  List<ScheduledRun> findRetryCandidates() throws SQLException {
    var sql =
        "SELECT * FROM %s.scheduled_runs WHERE retry_status = 'IN_PROGRESS' ORDER BY id"
            .formatted(schema);
    return queryRuns(sql, null);
  }

  List<ScheduledRun> findPendingLaunches() throws SQLException {
    var sql =
        """
        SELECT * FROM %s.scheduled_runs
        WHERE attempts_total = 0 AND status = 'SKIPPED'
        ORDER BY scheduled_at, id
        """
            .formatted(schema);
    return queryRuns(sql, null);
  }

  void update(ScheduledRun run) throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      updateRun(conn, run);
    }
  }

  private void updateRun(Connection conn, ScheduledRun run) throws SQLException {
    var sql =
        """
        UPDATE %s.scheduled_runs
        SET status = ?, retry_status = ?, attempts_total = ?, queued_at = ?, started_at = ?,
            finished_at = ?, log_links = ?, artifact_links = ?
        WHERE id = ?
        """
            .formatted(schema);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, name(run.status()));
      ps.setString(2, name(run.retryStatus()));
      ps.setInt(3, run.attemptsTotal());
      setInstant(ps, 4, run.queuedAt());
      setInstant(ps, 5, run.startedAt());
      setInstant(ps, 6, run.finishedAt());
      ps.setString(7, JSONUtil.toJson(run.logLinks()));
      ps.setString(8, JSONUtil.toJson(run.artifactLinks()));
      ps.setLong(9, run.id());
      if (ps.executeUpdate() == 0) {
        throw new NonExistentRunException(run.id());
      }
    }
  }

  boolean delete(long id) throws SQLException {
    var sql = "DELETE FROM %s.scheduled_runs WHERE id = ?".formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setLong(1, id);
      return ps.executeUpdate() > 0;
    }
  }

  Map<RunStatus, Long> countByStatus() throws SQLException {
    var sql =
        "SELECT status, COUNT(*) AS n FROM %s.scheduled_runs GROUP BY status".formatted(schema);
    Map<RunStatus, Long> counts = new EnumMap<>(RunStatus.class);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql);
        ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        counts.put(RunStatus.valueOf(rs.getString("status")), rs.getLong("n"));
      }
    }
    return counts;
  }

  Attempt recordAttempt(ScheduledRun launched, Attempt attempt) throws SQLException {
    try (Connection connection = dataSource.getConnection()) {
      connection.setAutoCommit(false);
      try {
        var runSql =
            """
            UPDATE %s.scheduled_runs
            SET attempts_total = ?, status = ?, retry_status = ?, queued_at = ?, started_at = NULL,
                finished_at = NULL, log_links = ?, artifact_links = ?
            WHERE id = ? AND attempts_total = ? AND status <> 'CANCELLED'
            """
                .formatted(schema);
        int updated;
        try (PreparedStatement ps = connection.prepareStatement(runSql)) {
          ps.setInt(1, attempt.attemptNumber());
          ps.setString(2, name(launched.status()));
          ps.setString(3, name(launched.retryStatus()));
          setInstant(ps, 4, attempt.queuedAt());
          ps.setString(5, JSONUtil.toJson(launched.logLinks()));
          ps.setString(6, JSONUtil.toJson(launched.artifactLinks()));
          ps.setLong(7, attempt.scheduledRunId());
          ps.setInt(8, attempt.attemptNumber() - 1);
          updated = ps.executeUpdate();
        }
        if (updated == 0) {
          connection.rollback();
          if (get(attempt.scheduledRunId()).isEmpty()) {
            throw new NonExistentRunException(attempt.scheduledRunId());
          }
          throw new AttemptConflictException(attempt.scheduledRunId(), attempt.attemptNumber());
        }

        var insertSql =
            """
            INSERT INTO %s.attempts
              (scheduled_run_id, attempt_number, job_handle, status, queued_at, started_at,
               finished_at, error_message)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """
                .formatted(schema);
        long id;
        try (PreparedStatement ps = connection.prepareStatement(insertSql)) {
          ps.setLong(1, attempt.scheduledRunId());
          ps.setInt(2, attempt.attemptNumber());
          ps.setString(3, attempt.jobHandle());
          ps.setString(4, name(attempt.status()));
          setInstant(ps, 5, attempt.queuedAt());
          setInstant(ps, 6, attempt.startedAt());
          setInstant(ps, 7, attempt.finishedAt());
          ps.setString(8, attempt.errorMessage());
          try (ResultSet rs = ps.executeQuery()) {
            rs.next();
            id = rs.getLong(1);
          }
        }
        connection.commit();
        return attempt.withId(id);
      } catch (SQLException e) {
        connection.rollback();
        throw e;
      }
    }
  }

  List<Attempt> listAttempts(long runId) throws SQLException {
    var sql =
        "SELECT * FROM %s.attempts WHERE scheduled_run_id = ? ORDER BY attempt_number"
            .formatted(schema);
    return queryAttempts(sql, runId);
  }

  List<Attempt> findActiveAttempts() throws SQLException {
    var sql =
        "SELECT * FROM %s.attempts WHERE status IN ('QUEUED', 'RUNNING') ORDER BY id"
            .formatted(schema);
    return queryAttempts(sql, null);
  }

  void saveAttemptAndRun(Attempt attempt, ScheduledRun run) throws SQLException {
    try (Connection connection = dataSource.getConnection()) {
      connection.setAutoCommit(false);
      try {
        var sql =
            """
            UPDATE %s.attempts
            SET status = ?, started_at = ?, finished_at = ?, error_message = ?
            WHERE id = ?
            """
                .formatted(schema);
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
          ps.setString(1, name(attempt.status()));
          setInstant(ps, 2, attempt.startedAt());
          setInstant(ps, 3, attempt.finishedAt());
          ps.setString(4, attempt.errorMessage());
          ps.setLong(5, attempt.id());
          ps.executeUpdate();
        }
        updateRun(connection, run);
        connection.commit();
      } catch (SQLException | RuntimeException e) {
        connection.rollback();
        throw e;
      }
    }
  }

  private List<ScheduledRun> queryRuns(String sql, Long param) throws SQLException {
    List<ScheduledRun> result = new ArrayList<>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      if (param != null) {
        ps.setLong(1, param);
      }
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          result.add(mapRun(rs));
        }
      }
    }
    return result;
  }

  private List<Attempt> queryAttempts(String sql, Long param) throws SQLException {
    List<Attempt> result = new ArrayList<>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      if (param != null) {
        ps.setLong(1, param);
      }
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          result.add(mapAttempt(rs));
        }
      }
    }
    return result;
  }

  private static ScheduledRun mapRun(ResultSet rs) throws SQLException {
    return new ScheduledRun(
        rs.getLong("id"),
        rs.getLong("schedule_id"),
        getEnum(rs, "triggering_event", TriggeringEvent.class),
        getEnum(rs, "status", RunStatus.class),
        getEnum(rs, "retry_status", RetryStatus.class),
        rs.getInt("attempts_total"),
        getInstant(rs, "scheduled_at"),
        getInstant(rs, "queued_at"),
        getInstant(rs, "started_at"),
        getInstant(rs, "finished_at"),
        JSONUtil.toObjectMap(rs.getString("environment_snapshot")),
        rs.getString("command"),
        JSONUtil.toStringMap(rs.getString("log_links")),
        JSONUtil.toStringMap(rs.getString("artifact_links")));
  }

  private static Attempt mapAttempt(ResultSet rs) throws SQLException {
    return new Attempt(
        rs.getLong("id"),
        rs.getLong("scheduled_run_id"),
        rs.getInt("attempt_number"),
        rs.getString("job_handle"),
        getEnum(rs, "status", AttemptStatus.class),
        getInstant(rs, "queued_at"),
        getInstant(rs, "started_at"),
        getInstant(rs, "finished_at"),
        rs.getString("error_message"));
  }
}
