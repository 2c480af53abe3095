package dev.pipeline.scheduler.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pipeline.scheduler.model.BackoffStrategy;
import dev.pipeline.scheduler.model.NotificationConfig;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.RetentionAction;
import dev.pipeline.scheduler.model.RetentionPolicy;
import dev.pipeline.scheduler.model.RetentionScope;
import dev.pipeline.scheduler.model.RetryPolicy;
import dev.pipeline.scheduler.model.SlackChannel;
import dev.pipeline.scheduler.model.WebhookChannel;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class JSONUtilTest {

  @Test
  public void notificationConfigColumn() {
    var config =
        NotificationConfig.empty()
            .withSlack(
                new SlackChannel(
                    "https://hooks.slack.example/T1", List.of(NotificationTrigger.RUN_FAILED), true))
            .withWebhook(
                new WebhookChannel(
                    "https://hooks.example.com", Map.of("X-Token", "t"), List.of(), false));

    var json = JSONUtil.toJson(config);
    assertFalse(json.contains("enabledChannels"));
    assertFalse(json.contains("\"type\""));

    var parsed = JSONUtil.fromJson(json, NotificationConfig.class);
    assertEquals(config, parsed);
    assertNull(parsed.email());
    assertEquals(1, parsed.enabledChannels().size());
  }

  @Test
  public void policyColumns() {
    var retry = RetryPolicy.exponential(3, 30, 600);
    assertEquals(retry, JSONUtil.fromJson(JSONUtil.toJson(retry), RetryPolicy.class));

    var retention =
        new RetentionPolicy(RetentionScope.PER_ENVIRONMENT, 20, null, RetentionAction.DELETE);
    assertEquals(retention, JSONUtil.fromJson(JSONUtil.toJson(retention), RetentionPolicy.class));
  }

  @Test
  public void missingFieldsTakeDefaults() {
    var retry = JSONUtil.fromJson("{\"maxRetries\":2,\"delaySeconds\":5}", RetryPolicy.class);
    assertEquals(BackoffStrategy.FIXED, retry.backoffStrategy());
    assertNull(retry.maxDelaySeconds());

    var retention = JSONUtil.fromJson("{\"keepLastNRuns\":5,\"unknown\":1}", RetentionPolicy.class);
    assertEquals(RetentionScope.PER_SCHEDULE, retention.scope());
    assertEquals(RetentionAction.ARCHIVE, retention.action());
  }

  @Test
  public void emptyInputs() {
    assertNull(JSONUtil.toJson(null));
    assertNull(JSONUtil.fromJson(null, RetryPolicy.class));
    assertTrue(JSONUtil.toObjectMap("").isEmpty());
    assertTrue(JSONUtil.toStringMap(null).isEmpty());
    assertEquals(Map.of("logs", "/x"), JSONUtil.toStringMap("{\"logs\":\"/x\"}"));
  }

  @Test
  public void malformedJson() {
    assertThrows(JSONUtil.JsonRuntimeException.class, () -> JSONUtil.toObjectMap("{not json"));
  }
}
