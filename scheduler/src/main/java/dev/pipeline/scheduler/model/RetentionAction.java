package dev.pipeline.scheduler.model;

public enum RetentionAction {
  ARCHIVE,
  DELETE
}
