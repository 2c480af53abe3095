package dev.pipeline.scheduler.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record WebhookChannel(
    String endpointUrl,
    Map<String, String> headers,
    List<NotificationTrigger> triggers,
    boolean enabled)
    implements ChannelConfig {

  public WebhookChannel {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    triggers = triggers == null ? List.of() : List.copyOf(triggers);
  }

  public WebhookChannel(String endpointUrl) {
    this(endpointUrl, Map.of(), List.of(), true);
  }

  @JsonIgnore
  @Override
  public NotificationChannelType type() {
    return NotificationChannelType.WEBHOOK;
  }
}
