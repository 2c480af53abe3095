package dev.pipeline.scheduler.notifications;

public record SendResult(boolean success, String errorMessage) {

  public static SendResult ok() {
    return new SendResult(true, null);
  }

  public static SendResult failed(String errorMessage) {
    return new SendResult(false, errorMessage);
  }
}
