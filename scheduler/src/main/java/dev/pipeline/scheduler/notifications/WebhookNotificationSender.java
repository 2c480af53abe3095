package dev.pipeline.scheduler.notifications;

import dev.pipeline.scheduler.model.ChannelConfig;
import dev.pipeline.scheduler.model.NotificationChannelType;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.WebhookChannel;

import java.time.Duration;
import java.util.Map;

/** Posts the payload as JSON to a user supplied endpoint, with the channel's extra headers. */
public class WebhookNotificationSender extends HttpNotificationSender {

  public WebhookNotificationSender(Duration timeout) {
    super(timeout);
  }

  @Override
  public NotificationChannelType type() {
    return NotificationChannelType.WEBHOOK;
  }

  @Override
  public SendResult send(
      ChannelConfig channel, NotificationTrigger trigger, Map<String, Object> payload) {
    var webhook = (WebhookChannel) channel;
    return post(webhook.endpointUrl(), webhook.headers(), payload);
  }
}
