/*
 * どこで: Reminder ドメインモデル
 * 何を: Event Source から取得した予定のスナップショット
 * なぜ: スケジュール計算・通知文面・在室監査で共通の形にするため
 */
package com.occasionbell.reminder.model;

import java.time.Instant;

public record Occasion(
    String occasionId,
    String name,
    Instant startAt,
    String locationRef,
    LocationType locationType,
    String groupRef,
    String hostName) {

  public boolean presenceSupported() {
    return locationType != null && locationType.presenceSupported() && locationRef != null;
  }
}
