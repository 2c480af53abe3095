package dev.pipeline.scheduler.migrations;

import dev.pipeline.scheduler.Constants;
import dev.pipeline.scheduler.config.SchedulerConfig;
import dev.pipeline.scheduler.database.SystemDatabase;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates the scheduler database, schema and tables, and applies pending schema migrations. */
public class MigrationManager {

  private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);
  private static final List<String> IGNORABLE_SQL_STATES =
      List.of(
          // Relation / object already exists
          "42P07", // duplicate_table
          "42710", // duplicate_object (e.g., index)
          "42701", // duplicate_column
          "42P06" // duplicate_schema
          );

  public static void runMigrations(SchedulerConfig config) {
    Objects.requireNonNull(config, "SchedulerConfig must not be null");

    if (config.dataSource() != null) {
      runMigrations(config.dataSource(), config.schema());
    } else {
      createDatabaseIfNotExists(config);
      try (var ds = SystemDatabase.createDataSource(config)) {
        runMigrations(ds, config.schema());
      }
    }
  }

  public static void runMigrations(HikariDataSource ds, String schema) {
    Objects.requireNonNull(ds, "Data Source must not be null");
    var schemaName = Objects.requireNonNullElse(schema, Constants.DB_SCHEMA);
    var quoted = SystemDatabase.sanitizeSchema(schemaName);

    try (var conn = ds.getConnection()) {
      ensureSchema(conn, schemaName, quoted);
      ensureMigrationTable(conn, schemaName, quoted);
      runSchedulerMigrations(conn, quoted, getMigrations(quoted));
    } catch (SQLException e) {
      throw new RuntimeException("Failed to run migrations", e);
    }
  }

  /** Drops the scheduler schema with every table in it */
  public static void dropSchema(HikariDataSource ds, String schema) {
    var quoted = SystemDatabase.sanitizeSchema(schema);
    try (var conn = ds.getConnection();
        var stmt = conn.createStatement()) {
      logger.info("Dropping schema {}", quoted);
      stmt.execute("DROP SCHEMA IF EXISTS %s CASCADE".formatted(quoted));
    } catch (SQLException e) {
      throw new RuntimeException("Failed to drop schema " + quoted, e);
    }
  }

  public static void createDatabaseIfNotExists(SchedulerConfig config) {
    Objects.requireNonNull(config, "SchedulerConfig must not be null");
    if (config.dataSource() != null) {
      logger.debug("SchedulerConfig specifies data source, skipping createDatabaseIfNotExists");
    } else {
      createDatabaseIfNotExists(config.databaseUrl(), config.dbUser(), config.dbPassword());
    }
  }

  public static void createDatabaseIfNotExists(String url, String user, String password) {
    Objects.requireNonNull(url, "database url must not be null");
    Objects.requireNonNull(user, "database user must not be null");

    var pair = extractDbAndPostgresUrl(url);

    try (var adminDS = SystemDatabase.createDataSource(pair.url(), user, password);
        var conn = adminDS.getConnection()) {
      try (var stmt = conn.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
        stmt.setString(1, pair.database());
        try (ResultSet rs = stmt.executeQuery()) {
          if (rs.next()) {
            logger.debug("Database '{}' already exists", pair.database());
            return;
          }
        }
      }

      logger.info("Creating '{}' database", pair.database());
      try (Statement stmt = conn.createStatement()) {
        stmt.executeUpdate("CREATE DATABASE \"" + pair.database() + "\"");
      }
    } catch (SQLException e) {
      logger.warn("Could not create database {} through {}", pair.database(), pair.url(), e);
    }
  }

  public record UrlPair(String url, String database) {}

  public static UrlPair extractDbAndPostgresUrl(String url) {
    int qm = Objects.requireNonNull(url, "database url must not be null").indexOf('?');
    var base = qm >= 0 ? url.substring(0, qm) : url;
    var params = qm >= 0 ? url.substring(qm) : "";
    int slash = base.lastIndexOf('/');
    if (slash < "jdbc:postgresql://".length()) {
      throw new IllegalArgumentException(String.format("JDBC URL %s is not valid", url));
    }

    var newUrl = base.substring(0, slash + 1) + Constants.POSTGRES_DEFAULT_DB + params;
    var databaseName = base.substring(slash + 1);
    return new UrlPair(newUrl, databaseName);
  }

  static void ensureSchema(Connection conn, String schemaName, String quoted)
      throws SQLException {
    var sql = "SELECT schema_name FROM information_schema.schemata WHERE schema_name = ?";
    try (var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, schemaName);
      try (var rs = stmt.executeQuery()) {
        if (rs.next()) {
          return;
        }
      }
    }

    try (var stmt = conn.createStatement()) {
      stmt.execute("CREATE SCHEMA IF NOT EXISTS %s".formatted(quoted));
    }
  }

  static void ensureMigrationTable(Connection conn, String schemaName, String quoted)
      throws SQLException {
    var sql =
        "SELECT table_name FROM information_schema.tables WHERE table_schema = ? AND table_name = 'pipesched_migrations'";
    try (var stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, schemaName);
      try (var rs = stmt.executeQuery()) {
        if (rs.next()) {
          return;
        }
      }
    }

    try (var stmt = conn.createStatement()) {
      stmt.execute(
          "CREATE TABLE IF NOT EXISTS %s.pipesched_migrations (version BIGINT NOT NULL PRIMARY KEY)"
              .formatted(quoted));
    }
  }

  public static int getCurrentVersion(Connection conn, String quoted) throws SQLException {
    var sql =
        "SELECT version FROM %s.pipesched_migrations ORDER BY version DESC limit 1"
            .formatted(quoted);
    try (var stmt = conn.createStatement();
        var rs = stmt.executeQuery(sql)) {
      if (rs.next()) {
        return rs.getInt("version");
      }
    }
    return 0;
  }

  static void runSchedulerMigrations(Connection conn, String quoted, List<String> migrations)
      throws SQLException {
    var lastApplied = getCurrentVersion(conn, quoted);

    for (var i = 0; i < migrations.size(); i++) {
      var migrationIndex = i + 1;
      if (migrationIndex <= lastApplied) {
        continue;
      }

      logger.info("Applying scheduler schema migration {}", migrationIndex);
      try (var stmt = conn.createStatement()) {
        stmt.execute(migrations.get(i));
      } catch (SQLException e) {
        if (IGNORABLE_SQL_STATES.contains(e.getSQLState())) {
          logger.warn(
              "Ignoring migration {} error; Migration was likely already applied. Occurred while executing {}",
              migrationIndex,
              migrations.get(i));
        } else {
          throw new RuntimeException("Failed to run migration %d".formatted(migrationIndex), e);
        }
      }

      int rowCount;
      var updateSQL = "UPDATE %s.pipesched_migrations SET version = ?".formatted(quoted);
      try (var stmt = conn.prepareStatement(updateSQL)) {
        stmt.setLong(1, migrationIndex);
        rowCount = stmt.executeUpdate();
      }
      if (rowCount == 0) {
        var insertSql =
            "INSERT INTO %s.pipesched_migrations (version) VALUES (?)".formatted(quoted);
        try (var stmt = conn.prepareStatement(insertSql)) {
          stmt.setLong(1, migrationIndex);
          stmt.executeUpdate();
        }
      }

      lastApplied = migrationIndex;
    }
  }

  public static List<String> getMigrations(String quotedSchema) {
    Objects.requireNonNull(quotedSchema);
    var migrations = List.of(migration1, migration2);
    return migrations.stream().map(m -> m.formatted(quotedSchema)).toList();
  }

  static final String migration1 =
      """
      CREATE TABLE %1$s.environments (
          id BIGSERIAL PRIMARY KEY,
          name TEXT NOT NULL UNIQUE,
          description TEXT,
          target_name TEXT,
          connection_profile TEXT,
          variables TEXT NOT NULL DEFAULT '{}',
          default_retention_policy TEXT,
          created_at BIGINT NOT NULL,
          updated_at BIGINT NOT NULL
      );

      CREATE TABLE %1$s.schedules (
          id BIGSERIAL PRIMARY KEY,
          name TEXT NOT NULL,
          description TEXT,
          cron_expression TEXT NOT NULL,
          timezone TEXT,
          command TEXT NOT NULL,
          environment_id BIGINT NOT NULL REFERENCES %1$s.environments(id),
          notification_config TEXT,
          retry_policy TEXT,
          retention_policy TEXT,
          catch_up_policy TEXT NOT NULL,
          overlap_policy TEXT NOT NULL,
          enabled BOOLEAN NOT NULL DEFAULT TRUE,
          status TEXT NOT NULL,
          next_run_time BIGINT,
          last_run_time BIGINT,
          created_by TEXT,
          updated_by TEXT,
          created_at BIGINT NOT NULL,
          updated_at BIGINT NOT NULL
      );

      CREATE TABLE %1$s.scheduled_runs (
          id BIGSERIAL PRIMARY KEY,
          schedule_id BIGINT NOT NULL REFERENCES %1$s.schedules(id) ON DELETE CASCADE,
          triggering_event TEXT NOT NULL,
          status TEXT NOT NULL,
          retry_status TEXT NOT NULL,
          attempts_total INTEGER NOT NULL DEFAULT 0,
          scheduled_at BIGINT NOT NULL,
          queued_at BIGINT,
          started_at BIGINT,
          finished_at BIGINT,
          environment_snapshot TEXT,
          command TEXT,
          log_links TEXT,
          artifact_links TEXT
      );

      CREATE TABLE %1$s.attempts (
          id BIGSERIAL PRIMARY KEY,
          scheduled_run_id BIGINT NOT NULL REFERENCES %1$s.scheduled_runs(id) ON DELETE CASCADE,
          attempt_number INTEGER NOT NULL,
          job_handle TEXT,
          status TEXT NOT NULL,
          queued_at BIGINT NOT NULL,
          started_at BIGINT,
          finished_at BIGINT,
          error_message TEXT,
          UNIQUE (scheduled_run_id, attempt_number)
      );

      CREATE TABLE %1$s.scheduler_events (
          id BIGSERIAL PRIMARY KEY,
          schedule_id BIGINT,
          scheduled_run_id BIGINT,
          level TEXT NOT NULL,
          event_type TEXT NOT NULL,
          message TEXT,
          details TEXT,
          created_at BIGINT NOT NULL
      );

      CREATE TABLE %1$s.notification_events (
          id BIGSERIAL PRIMARY KEY,
          scheduled_run_id BIGINT NOT NULL REFERENCES %1$s.scheduled_runs(id) ON DELETE CASCADE,
          channel TEXT NOT NULL,
          notification_trigger TEXT NOT NULL,
          status TEXT NOT NULL,
          error_message TEXT,
          payload TEXT,
          created_at BIGINT NOT NULL
      );
      """;

  static final String migration2 =
      """
      CREATE INDEX idx_schedules_due ON %1$s.schedules (enabled, next_run_time);
      CREATE INDEX idx_runs_schedule ON %1$s.scheduled_runs (schedule_id, scheduled_at DESC);
      CREATE INDEX idx_runs_retry_status ON %1$s.scheduled_runs (retry_status);
      CREATE INDEX idx_attempts_status ON %1$s.attempts (status);
      CREATE INDEX idx_events_schedule ON %1$s.scheduler_events (schedule_id, created_at DESC);
      """;
}
