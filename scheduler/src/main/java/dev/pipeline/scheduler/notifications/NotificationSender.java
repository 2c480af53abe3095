package dev.pipeline.scheduler.notifications;

import dev.pipeline.scheduler.model.ChannelConfig;
import dev.pipeline.scheduler.model.NotificationChannelType;
import dev.pipeline.scheduler.model.NotificationTrigger;

import java.util.Map;

/** Delivers notifications over one kind of channel. */
public interface NotificationSender {

  NotificationChannelType type();

  /** Sends the payload. Delivery failures are reported in the result, never thrown. */
  SendResult send(ChannelConfig channel, NotificationTrigger trigger, Map<String, Object> payload);
}
