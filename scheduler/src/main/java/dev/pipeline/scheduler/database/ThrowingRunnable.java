package dev.pipeline.scheduler.database;

@FunctionalInterface
public interface ThrowingRunnable<E extends Throwable> {
  void execute() throws E;
}
