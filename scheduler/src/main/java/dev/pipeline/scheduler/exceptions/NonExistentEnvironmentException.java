package dev.pipeline.scheduler.exceptions;

public class NonExistentEnvironmentException extends RuntimeException {
  private final long environmentId;

  public NonExistentEnvironmentException(long environmentId) {
    super("Environment %d does not exist".formatted(environmentId));
    this.environmentId = environmentId;
  }

  public long environmentId() {
    return environmentId;
  }
}
