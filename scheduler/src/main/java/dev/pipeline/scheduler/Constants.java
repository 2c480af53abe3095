package dev.pipeline.scheduler;

public class Constants {

  public static final String DB_SCHEMA = "pipesched";
  public static final String POSTGRES_DEFAULT_DB = "postgres";

  public static final String POSTGRES_PASSWORD_ENV_VAR = "PGPASSWORD";
  public static final String POSTGRES_USER_ENV_VAR = "PGUSER";
  public static final String SYSTEM_JDBC_URL_ENV_VAR = "PIPESCHED_JDBC_URL";

  public static final String DEFAULT_TIMEZONE = "UTC";
  public static final String DEFAULT_ENVIRONMENT_NAME = "default";
  public static final String DEFAULT_RUN_LINK_BASE_URL = "/execution/runs";

  public static final int DEFAULT_MAX_CATCHUP_RUNS = 10;
  public static final int DEFAULT_POLL_INTERVAL_SECONDS = 30;
}
