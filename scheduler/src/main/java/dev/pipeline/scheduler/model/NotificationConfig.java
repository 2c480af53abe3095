package dev.pipeline.scheduler.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;

/** Notification channels configured on a schedule. Any channel may be absent. */
public record NotificationConfig(SlackChannel slack, EmailChannel email, WebhookChannel webhook) {

  public static NotificationConfig empty() {
    return new NotificationConfig(null, null, null);
  }

  public NotificationConfig withSlack(SlackChannel slack) {
    return new NotificationConfig(slack, email, webhook);
  }

  public NotificationConfig withEmail(EmailChannel email) {
    return new NotificationConfig(slack, email, webhook);
  }

  public NotificationConfig withWebhook(WebhookChannel webhook) {
    return new NotificationConfig(slack, email, webhook);
  }

  /** Configured and enabled channels, in Slack, Email, Webhook order */
  @JsonIgnore
  public List<ChannelConfig> enabledChannels() {
    List<ChannelConfig> channels = new ArrayList<>();
    if (slack != null && slack.enabled()) {
      channels.add(slack);
    }
    if (email != null && email.enabled()) {
      channels.add(email);
    }
    if (webhook != null && webhook.enabled()) {
      channels.add(webhook);
    }
    return channels;
  }
}
