package dev.pipeline.scheduler.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record EmailChannel(
    List<String> recipients, List<NotificationTrigger> triggers, boolean enabled)
    implements ChannelConfig {

  public EmailChannel {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
    triggers = triggers == null ? List.of() : List.copyOf(triggers);
  }

  public EmailChannel(List<String> recipients) {
    this(recipients, List.of(), true);
  }

  @JsonIgnore
  @Override
  public NotificationChannelType type() {
    return NotificationChannelType.EMAIL;
  }
}
