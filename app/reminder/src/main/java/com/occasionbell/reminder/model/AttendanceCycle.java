/*
 * どこで: Reminder ドメインモデル
 * 何を: 朝の一覧通知 1 回分 (サイクル) の識別と状態
 * なぜ: 参加表明がどのサイクルに属するかを 1 つの値で判定するため
 */
package com.occasionbell.reminder.model;

import java.time.Instant;

public record AttendanceCycle(String notificationRef, Instant openedAt, CycleState state) {

  public AttendanceCycle close() {
    return new AttendanceCycle(notificationRef, openedAt, CycleState.CLOSED);
  }

  public boolean isOpenFor(String ref) {
    return state == CycleState.OPEN && notificationRef.equals(ref);
  }
}
