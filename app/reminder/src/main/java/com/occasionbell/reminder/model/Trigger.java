/*
 * どこで: Reminder ドメインモデル
 * 何を: コンパイル済みの単発ジョブ (識別子・発火時刻・アクション・ペイロード)
 * なぜ: 同一識別子は同一ジョブとして扱い、登録時に置き換えるため
 */
package com.occasionbell.reminder.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One compiled unit of scheduled work.
 *
 * <p>{@code id} is derived from stable fields only (occasion id plus offset kind, or a fixed name
 * for durable jobs). {@code recurrence} is the single-occurrence cron rendering of {@code fireAt}
 * in the application zone; it is informational and never used to arm the timer.
 *
 * @param occasion snapshot taken at compile time, {@code null} for durable jobs
 * @param offsetMinutes lead offset for lead notifications, audit delay for audits, otherwise 0
 */
public record Trigger(
    String id,
    TriggerKind kind,
    Instant fireAt,
    String recurrence,
    Occasion occasion,
    int offsetMinutes) {

  public static final String DAILY_SUMMARY_ID = "daily-summary";
  public static final String DAILY_RECONCILE_ID = "daily-reconcile";

  public Trigger {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(fireAt, "fireAt");
  }

  public TriggerScope scope() {
    return kind.scope();
  }

  public static String leadId(String occasionId, int offsetMinutes) {
    return "occasion:" + occasionId + ":lead:" + offsetMinutes;
  }

  public static String startId(String occasionId) {
    return "occasion:" + occasionId + ":start";
  }

  public static String auditId(String occasionId) {
    return "occasion:" + occasionId + ":audit";
  }
}
