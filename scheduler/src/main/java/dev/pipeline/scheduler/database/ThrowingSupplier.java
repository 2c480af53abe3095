package dev.pipeline.scheduler.database;

@FunctionalInterface
public interface ThrowingSupplier<T, E extends Throwable> {
  T execute() throws E;
}
