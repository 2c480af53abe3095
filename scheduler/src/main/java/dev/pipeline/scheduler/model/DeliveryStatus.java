package dev.pipeline.scheduler.model;

public enum DeliveryStatus {
  SUCCESS,
  FAILURE
}
