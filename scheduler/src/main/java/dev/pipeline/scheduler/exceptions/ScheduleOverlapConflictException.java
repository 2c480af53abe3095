package dev.pipeline.scheduler.exceptions;

/**
 * {@code ScheduleOverlapConflictException} is thrown when a run is requested for a schedule whose
 * overlap policy is NO_OVERLAP while another of its runs is still active. No run is created.
 */
public class ScheduleOverlapConflictException extends RuntimeException {
  private final long scheduleId;

  public ScheduleOverlapConflictException(long scheduleId) {
    super("Schedule %d has an active run and does not allow overlap".formatted(scheduleId));
    this.scheduleId = scheduleId;
  }

  public long scheduleId() {
    return scheduleId;
  }
}
