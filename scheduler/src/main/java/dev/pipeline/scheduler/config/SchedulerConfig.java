package dev.pipeline.scheduler.config;

import dev.pipeline.scheduler.Constants;

import java.time.Duration;

import com.zaxxer.hikari.HikariDataSource;

public record SchedulerConfig(
    String appName,
    String databaseUrl,
    String dbUser,
    String dbPassword,
    int maximumPoolSize,
    int connectionTimeout,
    HikariDataSource dataSource,
    String databaseSchema,
    boolean migrate,
    boolean schedulerEnabled,
    Duration pollInterval,
    int maxCatchupRuns,
    String defaultTimezone,
    int launchWorkers,
    int notificationWorkers,
    Duration shutdownTimeout,
    String runLinkBaseUrl,
    NotificationSettings notifications) {

  public SchedulerConfig {
    if (appName == null || appName.isEmpty()) {
      throw new IllegalArgumentException("SchedulerConfig.appName must not be null or empty");
    }
    if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
      throw new IllegalArgumentException("SchedulerConfig.pollInterval must be positive");
    }
    if (maxCatchupRuns < 1) {
      throw new IllegalArgumentException("SchedulerConfig.maxCatchupRuns must be at least 1");
    }
    if (launchWorkers < 1 || notificationWorkers < 1) {
      throw new IllegalArgumentException("SchedulerConfig worker counts must be positive");
    }
    if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("SchedulerConfig.shutdownTimeout must not be negative");
    }
    if (databaseSchema != null && databaseSchema.isEmpty()) {
      throw new IllegalArgumentException(
          "SchedulerConfig.databaseSchema must not be empty if specified");
    }
    if (defaultTimezone == null || defaultTimezone.isEmpty()) {
      defaultTimezone = Constants.DEFAULT_TIMEZONE;
    }
    if (runLinkBaseUrl == null) {
      runLinkBaseUrl = Constants.DEFAULT_RUN_LINK_BASE_URL;
    }
    if (notifications == null) {
      notifications = NotificationSettings.defaults();
    }
  }

  public static SchedulerConfig defaults(String appName) {
    return new SchedulerConfig(
        appName,
        null,
        null,
        null,
        3, // maximumPoolSize default
        30000, // connectionTimeout default
        null,
        null,
        true, // migrate
        true, // schedulerEnabled
        Duration.ofSeconds(Constants.DEFAULT_POLL_INTERVAL_SECONDS),
        Constants.DEFAULT_MAX_CATCHUP_RUNS,
        Constants.DEFAULT_TIMEZONE,
        4, // launchWorkers
        2, // notificationWorkers
        Duration.ofSeconds(30),
        Constants.DEFAULT_RUN_LINK_BASE_URL,
        NotificationSettings.defaults());
  }

  public static SchedulerConfig defaultsFromEnv(String appName) {
    String databaseUrl = System.getenv(Constants.SYSTEM_JDBC_URL_ENV_VAR);
    String dbUser = System.getenv(Constants.POSTGRES_USER_ENV_VAR);
    if (dbUser == null || dbUser.isEmpty()) dbUser = "postgres";
    String dbPassword = System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR);
    return defaults(appName)
        .withDatabaseUrl(databaseUrl)
        .withDbUser(dbUser)
        .withDbPassword(dbPassword);
  }

  /** The configured schema, or the default one */
  public String schema() {
    return databaseSchema == null ? Constants.DB_SCHEMA : databaseSchema;
  }

  public SchedulerConfig withAppName(String appName) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withDatabaseUrl(String databaseUrl) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withDbUser(String dbUser) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withDbPassword(String dbPassword) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withMaximumPoolSize(int maximumPoolSize) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withConnectionTimeout(int connectionTimeout) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withDataSource(HikariDataSource dataSource) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withDatabaseSchema(String databaseSchema) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withMigrate(boolean migrate) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withSchedulerEnabled(boolean schedulerEnabled) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withPollInterval(Duration pollInterval) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withMaxCatchupRuns(int maxCatchupRuns) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withDefaultTimezone(String defaultTimezone) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withLaunchWorkers(int launchWorkers) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withNotificationWorkers(int notificationWorkers) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withShutdownTimeout(Duration shutdownTimeout) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withRunLinkBaseUrl(String runLinkBaseUrl) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  public SchedulerConfig withNotifications(NotificationSettings notifications) {
    return new SchedulerConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        databaseSchema,
        migrate,
        schedulerEnabled,
        pollInterval,
        maxCatchupRuns,
        defaultTimezone,
        launchWorkers,
        notificationWorkers,
        shutdownTimeout,
        runLinkBaseUrl,
        notifications);
  }

  // Override toString to mask the DB password
  @Override
  public String toString() {
    return "SchedulerConfig[appName=%s, databaseUrl=%s, dbUser=%s, dbPassword=***, maximumPoolSize=%d, connectionTimeout=%d, dataSource=%s, databaseSchema=%s, migrate=%s, schedulerEnabled=%s, pollInterval=%s, maxCatchupRuns=%d, defaultTimezone=%s, launchWorkers=%d, notificationWorkers=%d, shutdownTimeout=%s, runLinkBaseUrl=%s, notifications=%s]"
        .formatted(
            appName,
            databaseUrl,
            dbUser,
            maximumPoolSize,
            connectionTimeout,
            dataSource,
            databaseSchema,
            migrate,
            schedulerEnabled,
            pollInterval,
            maxCatchupRuns,
            defaultTimezone,
            launchWorkers,
            notificationWorkers,
            shutdownTimeout,
            runLinkBaseUrl,
            notifications);
  }
}
