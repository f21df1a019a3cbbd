/*
 * どこで: Reminder ドメインモデル
 * 何を: Notification Sink へ渡す送信内容
 * なぜ: 送信先・本文・メンション先・リアクション候補をまとめて扱うため
 */
package com.occasionbell.reminder.model;

import java.util.List;

/**
 * @param audienceRef durable group mention, {@code null} when the message mentions nobody
 * @param reactions markers attached to the message for opt-in/opt-out, empty for plain messages
 */
public record OutboundMessage(
    String locationRef, String content, String audienceRef, List<String> reactions) {

  public OutboundMessage {
    reactions = reactions == null ? List.of() : List.copyOf(reactions);
  }

  public static OutboundMessage plain(String locationRef, String content) {
    return new OutboundMessage(locationRef, content, null, List.of());
  }
}
