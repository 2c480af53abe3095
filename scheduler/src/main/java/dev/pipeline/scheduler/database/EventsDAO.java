package dev.pipeline.scheduler.database;

import static dev.pipeline.scheduler.database.SqlTypes.getEnum;
import static dev.pipeline.scheduler.database.SqlTypes.getInstant;
import static dev.pipeline.scheduler.database.SqlTypes.getNullableLong;
import static dev.pipeline.scheduler.database.SqlTypes.name;
import static dev.pipeline.scheduler.database.SqlTypes.setInstant;
import static dev.pipeline.scheduler.database.SqlTypes.setNullableLong;

import dev.pipeline.scheduler.json.JSONUtil;
import dev.pipeline.scheduler.model.DeliveryStatus;
import dev.pipeline.scheduler.model.EventLevel;
import dev.pipeline.scheduler.model.NotificationChannelType;
import dev.pipeline.scheduler.model.NotificationEvent;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.SchedulerEvent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.zaxxer.hikari.HikariDataSource;

/** The append-only scheduler and notification logs. */
class EventsDAO {

  private final HikariDataSource dataSource;
  private final String schema;

  EventsDAO(HikariDataSource ds, String schema) {
    this.dataSource = ds;
    this.schema = Objects.requireNonNull(schema);
  }

  void recordSchedulerEvent(SchedulerEvent event) throws SQLException {
    var sql =
        """
        INSERT INTO %s.scheduler_events
          (schedule_id, scheduled_run_id, level, event_type, message, details, created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      setNullableLong(ps, 1, event.scheduleId());
      setNullableLong(ps, 2, event.scheduledRunId());
      ps.setString(3, name(event.level()));
      ps.setString(4, event.eventType());
      ps.setString(5, event.message());
      ps.setString(6, JSONUtil.toJson(event.details()));
      setInstant(ps, 7, event.timestamp());
      ps.executeUpdate();
    }
  }

  List<SchedulerEvent> listSchedulerEvents(Long scheduleId, int limit) throws SQLException {
    var sql =
        scheduleId == null
            ? "SELECT * FROM %s.scheduler_events ORDER BY created_at DESC, id DESC LIMIT ?"
                .formatted(schema)
            : """
              SELECT * FROM %s.scheduler_events
              WHERE schedule_id = ?
              ORDER BY created_at DESC, id DESC
              LIMIT ?
              """
                .formatted(schema);
    List<SchedulerEvent> result = new ArrayList<>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      int i = 1;
      if (scheduleId != null) {
        ps.setLong(i++, scheduleId);
      }
      ps.setInt(i, limit);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          result.add(
              new SchedulerEvent(
                  rs.getLong("id"),
                  getNullableLong(rs, "schedule_id"),
                  getNullableLong(rs, "scheduled_run_id"),
                  getEnum(rs, "level", EventLevel.class),
                  rs.getString("event_type"),
                  rs.getString("message"),
                  JSONUtil.toObjectMap(rs.getString("details")),
                  getInstant(rs, "created_at")));
        }
      }
    }
    return result;
  }

  void recordNotificationEvent(NotificationEvent event) throws SQLException {
    var sql =
        """
        INSERT INTO %s.notification_events
          (scheduled_run_id, channel, notification_trigger, status, error_message, payload,
           created_at)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setLong(1, event.scheduledRunId());
      ps.setString(2, name(event.channel()));
      ps.setString(3, name(event.trigger()));
      ps.setString(4, name(event.status()));
      ps.setString(5, event.errorMessage());
      ps.setString(6, JSONUtil.toJson(event.payload()));
      setInstant(ps, 7, event.createdAt());
      ps.executeUpdate();
    }
  }

  List<NotificationEvent> listNotificationEvents(long runId) throws SQLException {
    var sql =
        "SELECT * FROM %s.notification_events WHERE scheduled_run_id = ? ORDER BY id"
            .formatted(schema);
    List<NotificationEvent> result = new ArrayList<>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setLong(1, runId);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          result.add(
              new NotificationEvent(
                  rs.getLong("id"),
                  rs.getLong("scheduled_run_id"),
                  getEnum(rs, "channel", NotificationChannelType.class),
                  getEnum(rs, "notification_trigger", NotificationTrigger.class),
                  getEnum(rs, "status", DeliveryStatus.class),
                  rs.getString("error_message"),
                  JSONUtil.toObjectMap(rs.getString("payload")),
                  getInstant(rs, "created_at")));
        }
      }
    }
    return result;
  }
}
