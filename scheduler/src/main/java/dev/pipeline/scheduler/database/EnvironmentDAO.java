package dev.pipeline.scheduler.database;

import static dev.pipeline.scheduler.database.SqlTypes.getInstant;
import static dev.pipeline.scheduler.database.SqlTypes.setInstant;

import dev.pipeline.scheduler.exceptions.NonExistentEnvironmentException;
import dev.pipeline.scheduler.json.JSONUtil;
import dev.pipeline.scheduler.model.Environment;
import dev.pipeline.scheduler.model.RetentionPolicy;

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

class EnvironmentDAO {

  private final HikariDataSource dataSource;
  private final String schema;

  EnvironmentDAO(HikariDataSource ds, String schema) {
    this.dataSource = ds;
    this.schema = Objects.requireNonNull(schema);
  }

  Environment create(Environment env, Instant now) throws SQLException {
    var sql =
        """
        INSERT INTO %s.environments
          (name, description, target_name, connection_profile, variables,
           default_retention_policy, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?)
        RETURNING id
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, env.name());
      ps.setString(2, env.description());
      ps.setString(3, env.targetName());
      ps.setString(4, env.connectionProfile());
      ps.setString(5, JSONUtil.toJson(env.variables()));
      ps.setString(6, JSONUtil.toJson(env.defaultRetentionPolicy()));
      setInstant(ps, 7, now);
      setInstant(ps, 8, now);
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return env.withId(rs.getLong(1)).withTimestamps(now, now);
      }
    }
  }

  Optional<Environment> get(long id) throws SQLException {
    var sql = "SELECT * FROM %s.environments WHERE id = ?".formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setLong(1, id);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    }
  }

  Optional<Environment> getByName(String name) throws SQLException {
    var sql = "SELECT * FROM %s.environments WHERE name = ?".formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, name);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(map(rs)) : Optional.empty();
      }
    }
  }

  List<Environment> list() throws SQLException {
    var sql = "SELECT * FROM %s.environments ORDER BY id".formatted(schema);
    List<Environment> result = new ArrayList<>();
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql);
        ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        result.add(map(rs));
      }
    }
    return result;
  }

  Environment update(Environment env, Instant now) throws SQLException {
    var sql =
        """
        UPDATE %s.environments
        SET name = ?, description = ?, target_name = ?, connection_profile = ?, variables = ?,
            default_retention_policy = ?, updated_at = ?
        WHERE id = ?
        RETURNING created_at
        """
            .formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, env.name());
      ps.setString(2, env.description());
      ps.setString(3, env.targetName());
      ps.setString(4, env.connectionProfile());
      ps.setString(5, JSONUtil.toJson(env.variables()));
      ps.setString(6, JSONUtil.toJson(env.defaultRetentionPolicy()));
      setInstant(ps, 7, now);
      ps.setLong(8, env.id());
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new NonExistentEnvironmentException(env.id());
        }
        return env.withTimestamps(getInstant(rs, "created_at"), now);
      }
    }
  }

  boolean delete(long id) throws SQLException {
    var sql = "DELETE FROM %s.environments WHERE id = ?".formatted(schema);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setLong(1, id);
      return ps.executeUpdate() > 0;
    }
  }

  private static Environment map(ResultSet rs) throws SQLException {
    return new Environment(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("target_name"),
        rs.getString("connection_profile"),
        JSONUtil.toObjectMap(rs.getString("variables")),
        JSONUtil.fromJson(rs.getString("default_retention_policy"), RetentionPolicy.class),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
