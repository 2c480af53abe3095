package dev.pipeline.scheduler.notifications;

import dev.pipeline.scheduler.json.JSONUtil;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Posts JSON documents; any non-2xx response is a failed delivery. */
abstract class HttpNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(HttpNotificationSender.class);

  private final HttpClient client;
  private final Duration timeout;

  HttpNotificationSender(Duration timeout) {
    this.timeout = timeout;
    this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
  }

  SendResult post(String url, Map<String, String> headers, Object body) {
    if (url == null || url.isBlank()) {
      return SendResult.failed("No %s URL configured".formatted(type().name().toLowerCase()));
    }
    try {
      var builder =
          HttpRequest.newBuilder(URI.create(url))
              .timeout(timeout)
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofString(JSONUtil.toJson(body)));
      headers.forEach(builder::header);
      var response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
      int status = response.statusCode();
      if (status >= 200 && status < 300) {
        return SendResult.ok();
      }
      logger.warn("{} notification to {} returned HTTP {}", type(), url, status);
      return SendResult.failed("HTTP %d: %s".formatted(status, abbreviate(response.body())));
    } catch (IOException | IllegalArgumentException e) {
      logger.warn("{} notification to {} failed", type(), url, e);
      return SendResult.failed(e.toString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return SendResult.failed("Interrupted while sending notification");
    }
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > 200 ? body.substring(0, 200) + "..." : body;
  }
}
