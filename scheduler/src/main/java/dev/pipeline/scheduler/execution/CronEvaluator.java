package dev.pipeline.scheduler.execution;

import dev.pipeline.scheduler.exceptions.InvalidCronExpressionException;
import dev.pipeline.scheduler.exceptions.UnknownTimezoneException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import org.jspecify.annotations.Nullable;

/**
 * Computes fire times of five-field Unix cron expressions. Expressions are evaluated in the civil
 * time of the schedule's timezone; results are instants.
 */
public class CronEvaluator {

  private static final CronParser cronParser =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

  private final ZoneId defaultZone;
  private final Map<String, ExecutionTime> parsed = new ConcurrentHashMap<>();

  public CronEvaluator(String defaultTimezone) {
    this.defaultZone = zone(Objects.requireNonNull(defaultTimezone), null);
  }

  public CronEvaluator() {
    this("UTC");
  }

  /**
   * First instant strictly after {@code from} that matches {@code cronExpression} in {@code
   * timezone}. A null or blank timezone means the evaluator's default zone.
   *
   * @throws InvalidCronExpressionException if the expression does not parse or never fires
   * @throws UnknownTimezoneException if the timezone is not a known zone id
   */
  public Instant nextFireTime(String cronExpression, @Nullable String timezone, Instant from) {
    var zone = zone(timezone, defaultZone);
    var executionTime = executionTime(cronExpression);
    var cursor = ZonedDateTime.ofInstant(from, zone);
    var next =
        executionTime
            .nextExecution(cursor)
            .orElseThrow(
                () ->
                    new InvalidCronExpressionException(
                        cronExpression, "expression has no future fire time"));
    while (!next.toInstant().isAfter(from)) {
      cursor = next;
      next =
          executionTime
              .nextExecution(cursor)
              .orElseThrow(
                  () ->
                      new InvalidCronExpressionException(
                          cronExpression, "expression has no future fire time"));
    }
    return next.toInstant();
  }

  /** Parses both values, throwing the matching exception if either is invalid */
  public void validate(String cronExpression, @Nullable String timezone) {
    zone(timezone, defaultZone);
    executionTime(cronExpression);
  }

  private ExecutionTime executionTime(String cronExpression) {
    if (cronExpression == null || cronExpression.isBlank()) {
      throw new InvalidCronExpressionException(cronExpression, "expression is empty");
    }
    var key = cronExpression.trim();
    var cached = parsed.get(key);
    if (cached != null) {
      return cached;
    }
    Cron cron;
    try {
      cron = cronParser.parse(key);
      cron.validate();
    } catch (IllegalArgumentException e) {
      throw new InvalidCronExpressionException(cronExpression, e.getMessage(), e);
    }
    var executionTime = ExecutionTime.forCron(cron);
    parsed.put(key, executionTime);
    return executionTime;
  }

  private static ZoneId zone(String timezone, ZoneId fallback) {
    if (timezone == null || timezone.isBlank()) {
      if (fallback == null) {
        throw new UnknownTimezoneException(timezone, null);
      }
      return fallback;
    }
    try {
      return ZoneId.of(timezone.trim());
    } catch (DateTimeException e) {
      throw new UnknownTimezoneException(timezone, e);
    }
  }
}
