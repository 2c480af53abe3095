package dev.pipeline.scheduler.notifications;

import dev.pipeline.scheduler.model.ChannelConfig;
import dev.pipeline.scheduler.model.NotificationChannelType;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.SlackChannel;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/** Posts a text message to a Slack incoming webhook. */
public class SlackNotificationSender extends HttpNotificationSender {

  public SlackNotificationSender(Duration timeout) {
    super(timeout);
  }

  @Override
  public NotificationChannelType type() {
    return NotificationChannelType.SLACK;
  }

  @Override
  public SendResult send(
      ChannelConfig channel, NotificationTrigger trigger, Map<String, Object> payload) {
    var slack = (SlackChannel) channel;
    return post(slack.webhookUrl(), Map.of(), Map.of("text", message(payload)));
  }

  static String message(Map<String, Object> payload) {
    var text = new StringBuilder(NotificationPayload.summary(payload));
    var links = new LinkedHashMap<String, Object>();
    if (payload.get("log_links") instanceof Map<?, ?> logLinks) {
      logLinks.forEach((k, v) -> links.put(String.valueOf(k), v));
    }
    if (payload.get("artifact_links") instanceof Map<?, ?> artifactLinks) {
      artifactLinks.forEach((k, v) -> links.put(String.valueOf(k), v));
    }
    if (payload.get("error_message") != null) {
      text.append("\nError: ").append(payload.get("error_message"));
    }
    links.forEach(
        (name, url) -> text.append("\n<").append(url).append("|").append(name).append(">"));
    return text.toString();
  }
}
