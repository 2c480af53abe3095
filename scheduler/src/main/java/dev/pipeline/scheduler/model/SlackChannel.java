package dev.pipeline.scheduler.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record SlackChannel(String webhookUrl, List<NotificationTrigger> triggers, boolean enabled)
    implements ChannelConfig {

  public SlackChannel {
    triggers = triggers == null ? List.of() : List.copyOf(triggers);
  }

  public SlackChannel(String webhookUrl) {
    this(webhookUrl, List.of(), true);
  }

  @JsonIgnore
  @Override
  public NotificationChannelType type() {
    return NotificationChannelType.SLACK;
  }
}
