/*
 * どこで: Reminder サービス層
 * 何を: 管理コマンド入力の検証エラーを表す例外
 * なぜ: 永続化前に拒否し、API で 400 へ正規化するため
 */
package com.occasionbell.reminder.service;

public class SettingsValidationException extends RuntimeException {

  public SettingsValidationException(String message) {
    super(message);
  }

  public SettingsValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
