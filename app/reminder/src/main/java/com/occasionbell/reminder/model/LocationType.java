/*
 * どこで: Reminder ドメインモデル
 * 何を: 予定の開催場所の種別
 * なぜ: 在室スナップショットを取得できる場所かどうかを判定するため
 */
package com.occasionbell.reminder.model;

public enum LocationType {
  VOICE(true),
  STAGE(true),
  EXTERNAL(false);

  private final boolean presenceSupported;

  LocationType(boolean presenceSupported) {
    this.presenceSupported = presenceSupported;
  }

  public boolean presenceSupported() {
    return presenceSupported;
  }
}
