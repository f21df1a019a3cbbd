/*
 * どこで: Reminder ドメインモデル
 * 何を: 管理コマンドで変更できる通知設定 (朝の時刻/リード時間/開始通知/監査遅延)
 * なぜ: 設定ストアとスケジュール計算で同じ検証済みの値を使うため
 */
package com.occasionbell.reminder.model;

import com.occasionbell.reminder.service.SettingsValidationException;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Durable, user-tunable settings.
 *
 * <p>Documented defaults: daily time 07:00, lead offsets [60, 15], start notification disabled,
 * audit delay 10 minutes.
 */
public record ReminderSettings(
    LocalTime dailyTime,
    List<Integer> leadOffsets,
    boolean startNotificationEnabled,
    int auditDelayMinutes) {

  public static final LocalTime DEFAULT_DAILY_TIME = LocalTime.of(7, 0);
  public static final List<Integer> DEFAULT_LEAD_OFFSETS = List.of(60, 15);
  public static final boolean DEFAULT_START_NOTIFICATION_ENABLED = false;
  public static final int DEFAULT_AUDIT_DELAY_MINUTES = 10;

  public static final int MAX_LEAD_OFFSET_MINUTES = 24 * 60;
  public static final int MAX_LEAD_OFFSET_COUNT = 10;
  public static final int MAX_AUDIT_DELAY_MINUTES = 12 * 60;

  private static final DateTimeFormatter DAILY_TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

  public ReminderSettings {
    Objects.requireNonNull(dailyTime, "dailyTime");
    dailyTime = dailyTime.withSecond(0).withNano(0);
    leadOffsets = validateLeadOffsets(leadOffsets);
    validateAuditDelay(auditDelayMinutes);
  }

  public static ReminderSettings defaults() {
    return new ReminderSettings(
        DEFAULT_DAILY_TIME,
        DEFAULT_LEAD_OFFSETS,
        DEFAULT_START_NOTIFICATION_ENABLED,
        DEFAULT_AUDIT_DELAY_MINUTES);
  }

  public ReminderSettings withDailyTime(LocalTime value) {
    return new ReminderSettings(value, leadOffsets, startNotificationEnabled, auditDelayMinutes);
  }

  public ReminderSettings withLeadOffsets(List<Integer> value) {
    return new ReminderSettings(dailyTime, value, startNotificationEnabled, auditDelayMinutes);
  }

  public ReminderSettings withStartNotificationEnabled(boolean value) {
    return new ReminderSettings(dailyTime, leadOffsets, value, auditDelayMinutes);
  }

  public ReminderSettings withAuditDelayMinutes(int value) {
    return new ReminderSettings(dailyTime, leadOffsets, startNotificationEnabled, value);
  }

  public String formattedDailyTime() {
    return DAILY_TIME_FORMAT.format(dailyTime);
  }

  /** Strict {@code HH:MM} parser used by both the admin surface and the settings store. */
  public static LocalTime parseDailyTime(String raw) {
    if (raw == null || !raw.trim().matches("\\d{2}:\\d{2}")) {
      throw new SettingsValidationException("daily time must be HH:MM but was " + raw);
    }
    try {
      return LocalTime.parse(raw.trim(), DAILY_TIME_FORMAT);
    } catch (DateTimeParseException ex) {
      throw new SettingsValidationException("daily time is out of range: " + raw, ex);
    }
  }

  /** Keeps the given order and drops repeated values. */
  public static List<Integer> validateLeadOffsets(List<Integer> offsets) {
    if (offsets == null) {
      throw new SettingsValidationException("lead offsets are required");
    }
    final LinkedHashSet<Integer> distinct = new LinkedHashSet<>();
    for (Integer offset : offsets) {
      if (offset == null || offset < 0) {
        throw new SettingsValidationException("lead offsets must be non-negative minutes");
      }
      if (offset > MAX_LEAD_OFFSET_MINUTES) {
        throw new SettingsValidationException(
            "lead offset must be at most " + MAX_LEAD_OFFSET_MINUTES + " minutes but was " + offset);
      }
      distinct.add(offset);
    }
    if (distinct.size() > MAX_LEAD_OFFSET_COUNT) {
      throw new SettingsValidationException(
          "at most " + MAX_LEAD_OFFSET_COUNT + " lead offsets are allowed");
    }
    return List.copyOf(new ArrayList<>(distinct));
  }

  public static void validateAuditDelay(int minutes) {
    if (minutes <= 0 || minutes > MAX_AUDIT_DELAY_MINUTES) {
      throw new SettingsValidationException(
          "audit delay must be between 1 and " + MAX_AUDIT_DELAY_MINUTES + " minutes but was "
              + minutes);
    }
  }
}
