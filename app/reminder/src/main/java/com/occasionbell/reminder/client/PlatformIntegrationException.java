/*
 * どこで: Reminder クライアント層
 * 何を: チャット基盤 (予定/在室/送信) 呼び出し失敗を表現する
 * なぜ: 呼び出し元で「消えた」と「一時的失敗」を区別するため
 */
package com.occasionbell.reminder.client;

public class PlatformIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public PlatformIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public PlatformIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isNotFound() {
    return reason == Reason.NOT_FOUND;
  }
}
