/*
 * どこで: Reminder サービス層
 * 何を: 通知送信の失敗 (一時的失敗) を表す例外
 * なぜ: バックグラウンドではログのみ、強制実行時はユーザへ返すため
 */
package com.occasionbell.reminder.service;

public class NotificationSendException extends RuntimeException {

  public NotificationSendException(String message) {
    super(message);
  }

  public NotificationSendException(String message, Throwable cause) {
    super(message, cause);
  }
}
