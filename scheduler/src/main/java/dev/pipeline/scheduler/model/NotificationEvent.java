package dev.pipeline.scheduler.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Outcome of delivering one notification over one channel. */
public record NotificationEvent(
    Long id,
    long scheduledRunId,
    NotificationChannelType channel,
    NotificationTrigger trigger,
    DeliveryStatus status,
    String errorMessage,
    Map<String, Object> payload,
    Instant createdAt) {

  public NotificationEvent {
    payload =
        payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }
}
