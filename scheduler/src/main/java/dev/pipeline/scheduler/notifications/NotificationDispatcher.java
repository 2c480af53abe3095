package dev.pipeline.scheduler.notifications;

import dev.pipeline.scheduler.database.LifecycleStore;
import dev.pipeline.scheduler.model.Attempt;
import dev.pipeline.scheduler.model.ChannelConfig;
import dev.pipeline.scheduler.model.DeliveryStatus;
import dev.pipeline.scheduler.model.NotificationChannelType;
import dev.pipeline.scheduler.model.NotificationConfig;
import dev.pipeline.scheduler.model.NotificationEvent;
import dev.pipeline.scheduler.model.NotificationTestResult;
import dev.pipeline.scheduler.model.NotificationTrigger;
import dev.pipeline.scheduler.model.Schedule;
import dev.pipeline.scheduler.model.ScheduledRun;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends lifecycle notifications of scheduled runs to the channels configured on their schedule and
 * records one {@link NotificationEvent} per channel. Deliveries run on the executor passed in, off
 * the scheduler loop's thread.
 */
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final LifecycleStore store;
  private final Map<NotificationChannelType, NotificationSender> senders;
  private final Executor executor;
  private final Clock clock;

  public NotificationDispatcher(
      LifecycleStore store, List<NotificationSender> senders, Executor executor, Clock clock) {
    this.store = store;
    this.executor = executor;
    this.clock = clock;
    this.senders = new EnumMap<>(NotificationChannelType.class);
    for (var sender : senders) {
      this.senders.put(sender.type(), sender);
    }
  }

  /** Queues delivery of {@code trigger} for {@code run}; returns without waiting for it. */
  public void dispatch(Schedule schedule, ScheduledRun run, NotificationTrigger trigger) {
    if (schedule.notificationConfig().enabledChannels().isEmpty()) {
      return;
    }
    try {
      executor.execute(
          () -> {
            try {
              deliver(schedule, run, trigger);
            } catch (RuntimeException e) {
              logger.error("Notification {} for run {} failed", trigger, run.id(), e);
            }
          });
    } catch (RejectedExecutionException e) {
      logger.warn("Dropping {} notification for run {}: dispatcher is shut down", trigger, run.id());
    }
  }

  /**
   * Delivers {@code trigger} to every enabled channel subscribed to it, recording the outcomes. A
   * failing channel does not stop the others.
   */
  public List<NotificationEvent> deliver(
      Schedule schedule, ScheduledRun run, NotificationTrigger trigger) {
    var channels = subscribedChannels(schedule.notificationConfig(), trigger);
    if (channels.isEmpty()) {
      return List.of();
    }
    var attempts = store.listAttempts(run.id());
    Attempt latest = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
    var payload = NotificationPayload.forRun(trigger, schedule, run, latest);

    List<NotificationEvent> events = new ArrayList<>();
    for (var channel : channels) {
      var result = send(channel, trigger, payload);
      var event =
          new NotificationEvent(
              null,
              run.id(),
              channel.type(),
              trigger,
              result.success() ? DeliveryStatus.SUCCESS : DeliveryStatus.FAILURE,
              result.errorMessage(),
              payload,
              clock.instant());
      try {
        store.recordNotificationEvent(event);
      } catch (RuntimeException e) {
        logger.error("Failed to record {} notification for run {}", channel.type(), run.id(), e);
      }
      events.add(event);
      logger.info(
          "Notification {} for run {} over {}: {}",
          trigger.label(),
          run.id(),
          channel.type(),
          result.success() ? "sent" : result.errorMessage());
    }
    return events;
  }

  /** Sends a test payload to every enabled channel of {@code config}, synchronously. */
  public List<NotificationTestResult> sendTest(String scheduleName, NotificationConfig config) {
    var payload = NotificationPayload.forTest(scheduleName, clock.instant());
    List<NotificationTestResult> results = new ArrayList<>();
    for (var channel : config.enabledChannels()) {
      var result = send(channel, NotificationTrigger.RUN_STARTED, payload);
      results.add(
          new NotificationTestResult(channel.type(), result.success(), result.errorMessage()));
    }
    return results;
  }

  static List<ChannelConfig> subscribedChannels(
      NotificationConfig config, NotificationTrigger trigger) {
    return config.enabledChannels().stream().filter(c -> c.subscribedTo(trigger)).toList();
  }

  private SendResult send(
      ChannelConfig channel, NotificationTrigger trigger, Map<String, Object> payload) {
    var sender = senders.get(channel.type());
    if (sender == null) {
      return SendResult.failed("No sender registered for " + channel.type());
    }
    try {
      return sender.send(channel, trigger, payload);
    } catch (RuntimeException e) {
      logger.warn("{} sender threw", channel.type(), e);
      return SendResult.failed(e.toString());
    }
  }
}
