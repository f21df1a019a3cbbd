/*
 * どこで: Reminder サービス層
 * 何を: (現在時刻, 予定一覧, 設定) から必要なトリガー集合を計算する純粋関数
 * なぜ: 同じ入力から常に同じトリガー集合を得て、登録側で差分適用するため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.ReminderSettings;
import com.occasionbell.reminder.model.TimeWindow;
import com.occasionbell.reminder.model.Trigger;
import com.occasionbell.reminder.model.TriggerKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class ScheduleCompiler {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleCompiler.class);

  private static final Comparator<Occasion> OCCASION_ORDER =
      Comparator.comparing(Occasion::startAt).thenComparing(Occasion::occasionId);

  private final ZoneId zone;

  @Autowired
  public ScheduleCompiler(Clock clock) {
    this(clock.getZone());
  }

  public ScheduleCompiler(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public ZoneId zone() {
    return zone;
  }

  /**
   * Occasions whose start lies in this window get occasion-scoped triggers: today in the
   * configured zone, extended past midnight by the largest lead offset so that a lead
   * notification due before midnight for an early occasion tomorrow is not lost.
   *
   * <p>The window also reaches back before midnight by the audit delay, so an occasion that
   * started late yesterday keeps its pending presence audit after the day changes.
   */
  public TimeWindow lookAheadWindow(Instant now, ReminderSettings settings) {
    final LocalDate today = now.atZone(zone).toLocalDate();
    final Instant startOfToday = today.atStartOfDay(zone).toInstant();
    final Instant startOfTomorrow = today.plusDays(1).atStartOfDay(zone).toInstant();
    final int maxLead =
        settings.leadOffsets().stream().mapToInt(Integer::intValue).max().orElse(0);
    return new TimeWindow(
        startOfToday.minus(Duration.ofMinutes(settings.auditDelayMinutes())),
        startOfTomorrow.plus(Duration.ofMinutes(maxLead)));
  }

  public Set<Trigger> compile(
      Instant now, Collection<Occasion> occasions, ReminderSettings settings) {
    final Map<String, Trigger> triggers = new LinkedHashMap<>();
    addDurable(triggers, now, settings);

    final TimeWindow window = lookAheadWindow(now, settings);
    final List<Occasion> ordered =
        occasions.stream().filter(this::isCompilable).sorted(OCCASION_ORDER).toList();
    for (Occasion occasion : ordered) {
      if (!window.contains(occasion.startAt())) {
        continue;
      }
      addOccasion(triggers, now, occasion, settings);
    }
    return Collections.unmodifiableSet(new LinkedHashSet<>(triggers.values()));
  }

  private void addDurable(Map<String, Trigger> triggers, Instant now, ReminderSettings settings) {
    final LocalDate today = now.atZone(zone).toLocalDate();
    Instant summaryAt = ZonedDateTime.of(today, settings.dailyTime(), zone).toInstant();
    if (!summaryAt.isAfter(now)) {
      summaryAt = ZonedDateTime.of(today.plusDays(1), settings.dailyTime(), zone).toInstant();
    }
    add(triggers, now, Trigger.DAILY_SUMMARY_ID, TriggerKind.DAILY_SUMMARY, summaryAt, null, 0);

    final Instant boundaryAt = today.plusDays(1).atStartOfDay(zone).toInstant();
    add(triggers, now, Trigger.DAILY_RECONCILE_ID, TriggerKind.DAILY_RECONCILE, boundaryAt, null, 0);
  }

  private void addOccasion(
      Map<String, Trigger> triggers, Instant now, Occasion occasion, ReminderSettings settings) {
    final String occasionId = occasion.occasionId();
    final Instant startAt = occasion.startAt();
    for (int offset : settings.leadOffsets()) {
      if (offset == 0) {
        // 0 分前は開始通知と同じ扱い
        add(triggers, now, Trigger.startId(occasionId), TriggerKind.START_NOTIFICATION,
            startAt, occasion, 0);
        continue;
      }
      add(triggers, now, Trigger.leadId(occasionId, offset), TriggerKind.LEAD_NOTIFICATION,
          startAt.minus(Duration.ofMinutes(offset)), occasion, offset);
    }
    if (settings.startNotificationEnabled()) {
      add(triggers, now, Trigger.startId(occasionId), TriggerKind.START_NOTIFICATION,
          startAt, occasion, 0);
    }
    final int auditDelay = settings.auditDelayMinutes();
    add(triggers, now, Trigger.auditId(occasionId), TriggerKind.PRESENCE_AUDIT,
        startAt.plus(Duration.ofMinutes(auditDelay)), occasion, auditDelay);
  }

  private void add(
      Map<String, Trigger> triggers,
      Instant now,
      String id,
      TriggerKind kind,
      Instant rawFireAt,
      Occasion occasion,
      int offsetMinutes) {
    final Instant fireAt = rawFireAt.truncatedTo(ChronoUnit.SECONDS);
    if (!fireAt.isAfter(now) || triggers.containsKey(id)) {
      return;
    }
    final String recurrence = OneShotRecurrence.expressionFor(fireAt, zone);
    if (!OneShotRecurrence.roundTrips(recurrence, fireAt, zone)) {
      logger.warn("trigger skipped because fire time does not resolve id={} fireAt={} expr={}",
          id, fireAt, recurrence);
      return;
    }
    triggers.put(id, new Trigger(id, kind, fireAt, recurrence, occasion, offsetMinutes));
  }

  private boolean isCompilable(Occasion occasion) {
    if (occasion == null || occasion.occasionId() == null || occasion.occasionId().isBlank()) {
      logger.warn("occasion skipped because id is missing");
      return false;
    }
    if (occasion.startAt() == null) {
      logger.warn("occasion skipped because start is missing occasionId={}", occasion.occasionId());
      return false;
    }
    return true;
  }
}
