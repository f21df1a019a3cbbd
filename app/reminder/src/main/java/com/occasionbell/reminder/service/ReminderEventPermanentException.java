/*
 * どこで: Reminder サービス層
 * 何を: 恒久的なメッセージ処理失敗を示す例外
 * なぜ: NATS 再配信を止めて破棄する判断に使うため
 */
package com.occasionbell.reminder.service;

public class ReminderEventPermanentException extends RuntimeException {

  public ReminderEventPermanentException(String message) {
    super(message);
  }

  public ReminderEventPermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
