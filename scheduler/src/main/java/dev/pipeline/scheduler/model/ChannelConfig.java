package dev.pipeline.scheduler.model;

import java.util.List;

/** Common view over the configuration of one notification channel. */
public interface ChannelConfig {

  NotificationChannelType type();

  List<NotificationTrigger> triggers();

  boolean enabled();

  /** An empty trigger list subscribes the channel to every trigger. */
  default boolean subscribedTo(NotificationTrigger trigger) {
    var triggers = triggers();
    return triggers == null || triggers.isEmpty() || triggers.contains(trigger);
  }
}
