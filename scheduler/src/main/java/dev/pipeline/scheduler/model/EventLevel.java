package dev.pipeline.scheduler.model;

public enum EventLevel {
  DEBUG,
  INFO,
  WARN,
  ERROR
}
