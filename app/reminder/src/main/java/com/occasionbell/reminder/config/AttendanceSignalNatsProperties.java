/*
 * どこで: Reminder アプリの設定バインド
 * 何を: 参加/不参加シグナル購読設定 (subject/stream/durable/duplicate-window/ack-wait/max-deliver)
 * なぜ: 受信トピックと再配信制御を環境で調整し、起動時に妥当性を検証するため
 */
package com.occasionbell.reminder.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "reminder.nats.signals")
@Validated
public record AttendanceSignalNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver)
    implements JetStreamConsumerProperties {

  @AssertTrue(message = "reminder.nats.signals.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "reminder.nats.signals.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositiveDuration(ackWait);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提。
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
