/*
 * どこで: Reminder サービス層
 * 何を: 単発の発火時刻を「一度だけ一致する」cron 式へ変換し、逆に解決できるか検証する
 * なぜ: 外部スケジューラ向けの表現は境界の薄いアダプタに閉じ込めるため
 */
package com.occasionbell.reminder.service;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.springframework.scheduling.support.CronExpression;

/**
 * Single-occurrence cron rendering.
 *
 * <p>Second, minute, hour, day-of-month and month are pinned to the target's components in the
 * given zone, so the expression matches once a year at most. Timers are retired by removal from
 * the registry, never by cron semantics.
 */
public final class OneShotRecurrence {

  private OneShotRecurrence() {}

  public static String expressionFor(Instant fireAt, ZoneId zone) {
    final ZonedDateTime local = fireAt.atZone(zone);
    return local.getSecond()
        + " "
        + local.getMinute()
        + " "
        + local.getHour()
        + " "
        + local.getDayOfMonth()
        + " "
        + local.getMonthValue()
        + " *";
  }

  /**
   * Resolves {@code expression} to the first matching instant at or after {@code fireAt}. Empty
   * when the expression is malformed or when the wall-clock moment does not exist in the zone.
   */
  public static Optional<Instant> resolve(String expression, Instant fireAt, ZoneId zone) {
    if (!CronExpression.isValidExpression(expression)) {
      return Optional.empty();
    }
    final ZonedDateTime next =
        CronExpression.parse(expression).next(fireAt.minusSeconds(1).atZone(zone));
    return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
  }

  /** True when the rendered expression resolves back to exactly {@code fireAt}. */
  public static boolean roundTrips(String expression, Instant fireAt, ZoneId zone) {
    return resolve(expression, fireAt, zone).filter(fireAt::equals).isPresent();
  }
}
