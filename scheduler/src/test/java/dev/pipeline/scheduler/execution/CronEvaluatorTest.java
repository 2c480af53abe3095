package dev.pipeline.scheduler.execution;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.pipeline.scheduler.exceptions.InvalidCronExpressionException;
import dev.pipeline.scheduler.exceptions.UnknownTimezoneException;

import java.time.Instant;

import org.junit.jupiter.api.Test;

class CronEvaluatorTest {

  private final CronEvaluator evaluator = new CronEvaluator();

  @Test
  public void hourlyFromMidHour() {
    var next =
        evaluator.nextFireTime("0 * * * *", "UTC", Instant.parse("2024-01-01T00:05:00Z"));
    assertEquals(Instant.parse("2024-01-01T01:00:00Z"), next);
  }

  @Test
  public void resultIsStrictlyAfterFrom() {
    var from = Instant.parse("2024-01-01T01:00:00Z");
    var next = evaluator.nextFireTime("0 * * * *", "UTC", from);
    assertEquals(Instant.parse("2024-01-01T02:00:00Z"), next);
  }

  @Test
  public void everyMinuteSkipsSubMinuteRemainder() {
    var next =
        evaluator.nextFireTime("* * * * *", null, Instant.parse("2024-03-10T12:00:30Z"));
    assertEquals(Instant.parse("2024-03-10T12:01:00Z"), next);
  }

  @Test
  public void evaluatesInScheduleTimezone() {
    // 09:00 in New York is 14:00 UTC in winter and 13:00 UTC in summer
    var winter =
        evaluator.nextFireTime(
            "0 9 * * *", "America/New_York", Instant.parse("2024-01-15T00:00:00Z"));
    assertEquals(Instant.parse("2024-01-15T14:00:00Z"), winter);

    var summer =
        evaluator.nextFireTime(
            "0 9 * * *", "America/New_York", Instant.parse("2024-07-15T00:00:00Z"));
    assertEquals(Instant.parse("2024-07-15T13:00:00Z"), summer);
  }

  @Test
  public void blankTimezoneUsesDefault() {
    var berlin = new CronEvaluator("Europe/Berlin");
    var next = berlin.nextFireTime("0 9 * * *", " ", Instant.parse("2024-01-15T00:00:00Z"));
    assertEquals(Instant.parse("2024-01-15T08:00:00Z"), next);
  }

  @Test
  public void weekdayExpression() {
    // 2024-01-13 is a Saturday
    var next =
        evaluator.nextFireTime("30 6 * * 1-5", "UTC", Instant.parse("2024-01-13T10:00:00Z"));
    assertEquals(Instant.parse("2024-01-15T06:30:00Z"), next);
  }

  @Test
  public void invalidExpression() {
    var from = Instant.parse("2024-01-01T00:00:00Z");
    var e =
        assertThrows(
            InvalidCronExpressionException.class,
            () -> evaluator.nextFireTime("not a cron", "UTC", from));
    assertTrue(e.getMessage().contains("not a cron"));

    assertThrows(
        InvalidCronExpressionException.class, () -> evaluator.nextFireTime("* * *", "UTC", from));
    assertThrows(
        InvalidCronExpressionException.class, () -> evaluator.nextFireTime("  ", "UTC", from));
  }

  @Test
  public void unknownTimezone() {
    assertThrows(
        UnknownTimezoneException.class,
        () ->
            evaluator.nextFireTime(
                "0 * * * *", "Mars/Olympus_Mons", Instant.parse("2024-01-01T00:00:00Z")));
    assertThrows(UnknownTimezoneException.class, () -> new CronEvaluator("Not/AZone"));
  }

  @Test
  public void validate() {
    assertDoesNotThrow(() -> evaluator.validate("*/15 * * * *", "Europe/London"));
    assertThrows(InvalidCronExpressionException.class, () -> evaluator.validate("61 * * * *", "UTC"));
    assertThrows(UnknownTimezoneException.class, () -> evaluator.validate("0 * * * *", "Nowhere"));
  }
}
