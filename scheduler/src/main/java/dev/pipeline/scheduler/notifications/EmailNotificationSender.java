package dev.pipeline.scheduler.notifications;

import dev.pipeline.scheduler.config.NotificationSettings;
import dev.pipeline.scheduler.json.JSONUtil;
import dev.pipeline.scheduler.model.ChannelConfig;
import dev.pipeline.scheduler.model.EmailChannel;
import dev.pipeline.scheduler.model.NotificationChannelType;
import dev.pipeline.scheduler.model.NotificationTrigger;

import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.commons.mail.Email;
import org.apache.commons.mail.EmailException;
import org.apache.commons.mail.SimpleEmail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends a plain-text email over SMTP to every recipient of the channel. */
public class EmailNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(EmailNotificationSender.class);

  private final NotificationSettings settings;

  public EmailNotificationSender(NotificationSettings settings) {
    this.settings = settings;
  }

  @Override
  public NotificationChannelType type() {
    return NotificationChannelType.EMAIL;
  }

  @Override
  public SendResult send(
      ChannelConfig channel, NotificationTrigger trigger, Map<String, Object> payload) {
    var emailChannel = (EmailChannel) channel;
    if (settings.smtpHost() == null || settings.smtpHost().isBlank()) {
      return SendResult.failed("No SMTP host configured");
    }
    if (emailChannel.recipients().isEmpty()) {
      return SendResult.failed("Email channel has no recipients");
    }
    try {
      Email email = newEmail();
      email.setHostName(settings.smtpHost());
      email.setSmtpPort(settings.smtpPort());
      email.setStartTLSEnabled(settings.smtpStartTls());
      int timeoutMillis = timeoutMillis(settings.httpTimeout());
      email.setSocketConnectionTimeout(timeoutMillis);
      email.setSocketTimeout(timeoutMillis);
      if (settings.smtpUser() != null && settings.smtpPassword() != null) {
        email.setAuthentication(settings.smtpUser(), settings.smtpPassword());
      }
      email.setFrom(settings.fromAddress());
      for (String to : emailChannel.recipients()) {
        email.addTo(to);
      }
      email.setSubject("[pipesched] " + NotificationPayload.summary(payload));
      email.setMsg(body(payload));
      email.send();
      return SendResult.ok();
    } catch (EmailException e) {
      logger.warn("Email notification to {} failed", emailChannel.recipients(), e);
      return SendResult.failed(e.getMessage());
    }
  }

  Email newEmail() {
    return new SimpleEmail();
  }

  /** Socket timeout for the mail client, clamped to what an int of milliseconds can hold */
  static int timeoutMillis(Duration timeout) {
    if (timeout.isNegative()) {
      return 0;
    }
    if (timeout.compareTo(Duration.ofMillis(Integer.MAX_VALUE)) > 0) {
      return Integer.MAX_VALUE;
    }
    return (int) timeout.toMillis();
  }

  static String body(Map<String, Object> payload) {
    var body = new StringBuilder(NotificationPayload.summary(payload)).append("\n\n");
    try {
      body.append(
          JSONUtil.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(payload));
    } catch (JsonProcessingException e) {
      throw new JSONUtil.JsonRuntimeException(e);
    }
    return body.toString();
  }
}
