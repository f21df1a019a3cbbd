/*
 * どこで: Reminder サービス層
 * 何を: 通知送信 (Notification Sink) の抽象化インターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.model.OutboundMessage;
import com.occasionbell.reminder.model.SentMessage;

public interface NotificationSender {

  /**
   * @throws NotificationSendException when delivery failed; callers do not retry
   */
  SentMessage send(OutboundMessage message);
}
