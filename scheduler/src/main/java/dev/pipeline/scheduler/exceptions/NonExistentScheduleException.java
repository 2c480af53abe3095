package dev.pipeline.scheduler.exceptions;

public class NonExistentScheduleException extends RuntimeException {
  private final long scheduleId;

  public NonExistentScheduleException(long scheduleId) {
    super("Schedule %d does not exist".formatted(scheduleId));
    this.scheduleId = scheduleId;
  }

  public long scheduleId() {
    return scheduleId;
  }
}
