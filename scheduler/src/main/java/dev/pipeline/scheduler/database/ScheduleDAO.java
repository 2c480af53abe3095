package dev.pipeline.scheduler.database;

import static dev.pipeline.scheduler.database.SqlTypes.getEnum;
import static dev.pipeline.scheduler.database.SqlTypes.getInstant;
import static dev.pipeline.scheduler.database.SqlTypes.name;
import static dev.pipeline.scheduler.database.SqlTypes.setInstant;

import dev.pipeline.scheduler.exceptions.NonExistentScheduleException;
import dev.pipeline.scheduler.json.JSONUtil;
import dev.pipeline.scheduler.model.CatchUpPolicy;
import dev.pipeline.scheduler.model.NotificationConfig;
import dev.pipeline.scheduler.model.OverlapPolicy;
import dev.pipeline.scheduler.model.RetentionPolicy;
import dev.pipeline.scheduler.model.RetryPolicy;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduleStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariDataSource;

class ScheduleDAO {

  private final HikariDataSource dataSource;
  private final String schema;

  ScheduleDAO(HikariDataSource ds, String schema) {
    this.dataSource = ds;
    this.schema = Objects.requireNonNull(schema);
  }

  Schedule create(Schedule s, Instant now) throws SQLException {
    var sql =
        """
        INSERT INTO %s.schedules
          (name, description, cron_expression, timezone, command, environment_id,
           notification_config, retry_policy, retention_policy, catch_up_policy, overlap_policy,
           enabled, status, next_run_time, last_run_time, created_by, updated_by,
           created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING id
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      int i = bindColumns(ps, s);
      setInstant(ps, i++, now);
      setInstant(ps, i, now);
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return s.withId(rs.getLong(1)).withTimestamps(now, now);
      }
    }
  }

  Schedule update(Schedule s, Instant now) throws SQLException {
    var sql =
        """
        UPDATE %s.schedules
        SET name = ?, description = ?, cron_expression = ?, timezone = ?, command = ?,
            environment_id = ?, notification_config = ?, retry_policy = ?, retention_policy = ?,
            catch_up_policy = ?, overlap_policy = ?, enabled = ?, status = ?, next_run_time = ?,
            last_run_time = ?, created_by = ?, updated_by = ?, updated_at = ?
        WHERE id = ?
        RETURNING created_at
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      int i = bindColumns(ps, s);
      setInstant(ps, i++, now);
      ps.setLong(i, s.id());
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new NonExistentScheduleException(s.id());
        }
        return s.withTimestamps(getInstant(rs, "created_at"), now);
      }
    }
  }

  private static int bindColumns(PreparedStatement ps, Schedule s) throws SQLException {
    int i = 1;
    ps.setString(i++, s.name());
    ps.setString(i++, s.description());
    ps.setString(i++, s.cronExpression());
    ps.setString(i++, s.timezone());
    ps.setString(i++, s.command());
    ps.setLong(i++, s.environmentId());
    ps.setString(i++, JSONUtil.toJson(s.notificationConfig()));
    ps.setString(i++, JSONUtil.toJson(s.retryPolicy()));
    ps.setString(i++, JSONUtil.toJson(s.retentionPolicy()));
    ps.setString(i++, name(s.catchUpPolicy()));
    ps.setString(i++, name(s.overlapPolicy()));
    ps.setBoolean(i++, s.enabled());
    ps.setString(i++, name(s.status()));
    setInstant(ps, i++, s.nextRunTime());
    setInstant(ps, i++, s.lastRunTime());
    ps.setString(i++, s.createdBy());
    ps.setString(i++, s.updatedBy());
    return i;
  }

  Optional<Schedule> get(long id) throws SQLException {
    var sql = "SELECT * FROM %s.schedules WHERE id = ?".formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setLong(1, id);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    }
  }

  List<Schedule> list() throws SQLException {
    return query("SELECT * FROM %s.schedules ORDER BY id".formatted(schema), null);
  }

  List<Schedule> listForEnvironment(long environmentId) throws SQLException {
    return query(
        "SELECT * FROM %s.schedules WHERE environment_id = ? ORDER BY id".formatted(schema),
        environmentId);
  }

  List<Schedule> findDue(Instant now) throws SQLException {
    var sql =
        """
        SELECT * FROM %s.schedules
        WHERE enabled = TRUE AND next_run_time IS NOT NULL AND next_run_time <= ?
        ORDER BY next_run_time, id
        """
            .formatted(schema);
    return query(sql, now.toEpochMilli());
  }

  private List<Schedule> query(String sql, Long param) throws SQLException {
    List<Schedule> result = new ArrayList<>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      if (param != null) {
        ps.setLong(1, param);
      }
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          result.add(map(rs));
        }
      }
    }
    return result;
  }

  void advance(long id, Instant nextRunTime, Instant lastRunTime, Instant now)
      throws SQLException {
    var sql =
        """
        UPDATE %s.schedules
        SET next_run_time = ?, last_run_time = COALESCE(?, last_run_time), updated_at = ?
        WHERE id = ?
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      setInstant(ps, 1, nextRunTime);
      setInstant(ps, 2, lastRunTime);
      setInstant(ps, 3, now);
      ps.setLong(4, id);
      if (ps.executeUpdate() == 0) {
        throw new NonExistentScheduleException(id);
      }
    }
  }

  boolean delete(long id) throws SQLException {
    var sql = "DELETE FROM %s.schedules WHERE id = ?".formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setLong(1, id);
      return ps.executeUpdate() > 0;
    }
  }

  private static Schedule map(ResultSet rs) throws SQLException {
    return new Schedule(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("cron_expression"),
        rs.getString("timezone"),
        rs.getString("command"),
        rs.getLong("environment_id"),
        JSONUtil.fromJson(rs.getString("notification_config"), NotificationConfig.class),
        JSONUtil.fromJson(rs.getString("retry_policy"), RetryPolicy.class),
        JSONUtil.fromJson(rs.getString("retention_policy"), RetentionPolicy.class),
        getEnum(rs, "catch_up_policy", CatchUpPolicy.class),
        getEnum(rs, "overlap_policy", OverlapPolicy.class),
        rs.getBoolean("enabled"),
        getEnum(rs, "status", ScheduleStatus.class),
        getInstant(rs, "next_run_time"),
        getInstant(rs, "last_run_time"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"),
        rs.getString("created_by"),
        rs.getString("updated_by"));
  }
}
