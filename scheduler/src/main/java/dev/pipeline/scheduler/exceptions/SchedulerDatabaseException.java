package dev.pipeline.scheduler.exceptions;

import java.sql.SQLException;

/**
 * This exception is thrown when the scheduler database cannot be reached, despite numerous
 * retries, or rejects a statement outright. The scheduler loop logs it and tries again on the next
 * tick.
 */
public class SchedulerDatabaseException extends RuntimeException {
  private final Throwable underlyingException;

  public SchedulerDatabaseException(Throwable e) {
    super(
        String.format(
            "Scheduler database access error:%s %s",
            e instanceof SQLException ? " " + ((SQLException) e).getSQLState() : "",
            e.getMessage()),
        e);
    this.underlyingException = e;
  }

  /** A recent exception received from the database connection */
  public Throwable databaseException() {
    return underlyingException;
  }
}
