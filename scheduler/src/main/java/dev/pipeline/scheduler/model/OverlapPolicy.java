package dev.pipeline.scheduler.model;

public enum OverlapPolicy {
  NO_OVERLAP,
  ALLOW_OVERLAP
}
