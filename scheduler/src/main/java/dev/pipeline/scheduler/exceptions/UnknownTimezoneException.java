package dev.pipeline.scheduler.exceptions;

/** Thrown when a schedule's timezone is not a resolvable zone id. */
public class UnknownTimezoneException extends RuntimeException {
  private final String timezone;

  public UnknownTimezoneException(String timezone, Throwable cause) {
    super("Unknown timezone '%s'".formatted(timezone), cause);
    this.timezone = timezone;
  }

  public String timezone() {
    return timezone;
  }
}
