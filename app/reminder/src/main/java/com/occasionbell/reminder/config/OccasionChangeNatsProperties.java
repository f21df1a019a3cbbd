/*
 * どこで: Reminder 設定
 * 何を: 予定変更通知の購読設定を保持する
 * なぜ: シグナルと別 subject/stream/durable を運用で切り替えるため
 */
package com.occasionbell.reminder.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "reminder.nats.occasion-changes")
@Validated
public record OccasionChangeNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver)
    implements JetStreamConsumerProperties {

  @AssertTrue(message = "reminder.nats.occasion-changes.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return duplicateWindow != null && !duplicateWindow.isZero() && !duplicateWindow.isNegative();
  }

  @AssertTrue(message = "reminder.nats.occasion-changes.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return ackWait != null && !ackWait.isZero() && !ackWait.isNegative();
  }
}
