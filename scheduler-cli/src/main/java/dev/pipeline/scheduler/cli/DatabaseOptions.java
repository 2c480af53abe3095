package dev.pipeline.scheduler.cli;

import dev.pipeline.scheduler.Constants;
import dev.pipeline.scheduler.config.SchedulerConfig;

import java.util.Objects;

import picocli.CommandLine.Option;

public class DatabaseOptions {
  @Option(
      names = {"-D", "--db-url"},
      description = "Scheduler database URL (defaults to PIPESCHED_JDBC_URL env var)")
  private String url;

  @Option(
      names = {"-U", "--db-user"},
      description = "user name for the scheduler database (defaults to PGUSER env var)")
  private String user;

  @Option(
      names = {"-P", "--db-password"},
      description = "password for the scheduler database (defaults to PGPASSWORD env var)",
      arity = "0..1",
      interactive = true)
  private String password;

  @Option(
      names = {"--schema"},
      description = "Database schema holding the scheduler tables (default: pipesched)")
  private String schema;

  public String url() {
    return Objects.requireNonNullElseGet(
        this.url, () -> System.getenv(Constants.SYSTEM_JDBC_URL_ENV_VAR));
  }

  public String user() {
    var value =
        Objects.requireNonNullElseGet(
            this.user, () -> System.getenv(Constants.POSTGRES_USER_ENV_VAR));
    return value == null || value.isEmpty() ? "postgres" : value;
  }

  public String password() {
    return Objects.requireNonNullElseGet(
        this.password, () -> System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR));
  }

  public String schema() {
    return Objects.requireNonNullElse(this.schema, Constants.DB_SCHEMA);
  }

  /** Configuration for commands that only use the management API: no loop, no migrations. */
  public SchedulerConfig config() {
    var url = url();
    if (url == null || url.isEmpty()) {
      throw new IllegalArgumentException(
          "No database URL: pass --db-url or set " + Constants.SYSTEM_JDBC_URL_ENV_VAR);
    }
    return SchedulerConfig.defaults("pipesched-cli")
        .withDatabaseUrl(url)
        .withDbUser(user())
        .withDbPassword(password())
        .withDatabaseSchema(schema())
        .withMigrate(false)
        .withSchedulerEnabled(false);
  }
}
