package dev.pipeline.scheduler.model;

public enum CatchUpPolicy {
  SKIP,
  CATCH_UP
}
