package dev.pipeline.scheduler.exceptions;

/** Thrown when a schedule's cron expression cannot be parsed or never fires. */
public class InvalidCronExpressionException extends RuntimeException {
  private final String cronExpression;

  public InvalidCronExpressionException(String cronExpression, String reason) {
    this(cronExpression, reason, null);
  }

  public InvalidCronExpressionException(String cronExpression, String reason, Throwable cause) {
    super("Invalid cron expression '%s': %s".formatted(cronExpression, reason), cause);
    this.cronExpression = cronExpression;
  }

  public String cronExpression() {
    return cronExpression;
  }
}
