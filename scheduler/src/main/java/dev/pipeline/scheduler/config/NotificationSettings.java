package dev.pipeline.scheduler.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Transport settings for the built-in notification senders.
 *
 * @param httpTimeout request timeout for Slack and webhook posts
 * @param smtpHost SMTP server for email notifications; email is disabled when null
 */
public record NotificationSettings(
    Duration httpTimeout,
    String smtpHost,
    int smtpPort,
    boolean smtpStartTls,
    String smtpUser,
    String smtpPassword,
    String fromAddress) {

  public NotificationSettings {
    Objects.requireNonNull(httpTimeout, "NotificationSettings.httpTimeout must not be null");
    if (httpTimeout.isNegative() || httpTimeout.isZero()) {
      throw new IllegalArgumentException("NotificationSettings.httpTimeout must be positive");
    }
    if (smtpPort <= 0) {
      throw new IllegalArgumentException("NotificationSettings.smtpPort must be positive");
    }
  }

  public static NotificationSettings defaults() {
    return new NotificationSettings(
        Duration.ofSeconds(10), null, 587, true, null, null, "pipesched@localhost");
  }

  public NotificationSettings withHttpTimeout(Duration httpTimeout) {
    return new NotificationSettings(
        httpTimeout,
        smtpHost,
        smtpPort,
        smtpStartTls,
        smtpUser,
        smtpPassword,
        fromAddress);
  }

  public NotificationSettings withSmtpHost(String smtpHost) {
    return new NotificationSettings(
        httpTimeout,
        smtpHost,
        smtpPort,
        smtpStartTls,
        smtpUser,
        smtpPassword,
        fromAddress);
  }

  public NotificationSettings withSmtpPort(int smtpPort) {
    return new NotificationSettings(
        httpTimeout,
        smtpHost,
        smtpPort,
        smtpStartTls,
        smtpUser,
        smtpPassword,
        fromAddress);
  }

  public NotificationSettings withSmtpStartTls(boolean smtpStartTls) {
    return new NotificationSettings(
        httpTimeout,
        smtpHost,
        smtpPort,
        smtpStartTls,
        smtpUser,
        smtpPassword,
        fromAddress);
  }

  public NotificationSettings withSmtpUser(String smtpUser) {
    return new NotificationSettings(
        httpTimeout,
        smtpHost,
        smtpPort,
        smtpStartTls,
        smtpUser,
        smtpPassword,
        fromAddress);
  }

  public NotificationSettings withSmtpPassword(String smtpPassword) {
    return new NotificationSettings(
        httpTimeout,
        smtpHost,
        smtpPort,
        smtpStartTls,
        smtpUser,
        smtpPassword,
        fromAddress);
  }

  public NotificationSettings withFromAddress(String fromAddress) {
    return new NotificationSettings(
        httpTimeout,
        smtpHost,
        smtpPort,
        smtpStartTls,
        smtpUser,
        smtpPassword,
        fromAddress);
  }

  @Override
  public String toString() {
    return "NotificationSettings[httpTimeout=%s, smtpHost=%s, smtpPort=%d, smtpStartTls=%s, smtpUser=%s, smtpPassword=***, fromAddress=%s]"
        .formatted(httpTimeout, smtpHost, smtpPort, smtpStartTls, smtpUser, fromAddress);
  }
}
