/*
 * どこで: Reminder 設定のバリデーションテスト
 * 何を: シグナル/予定変更購読設定の Bean Validation を検証する
 * なぜ: 起動時に不正な NATS 設定を検出できるようにするため
 */
package com.occasionbell.reminder.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReminderNatsPropertiesValidationTest {

  private static final String SUBJECT = "reminder.attendance.signal";
  private static final String STREAM = "REMINDER_SIGNALS";
  private static final String DURABLE = "reminder-attendance-signal";
  private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
  private static final Duration ACK_WAIT = Duration.ofSeconds(30);
  private static final int MAX_DELIVER = 5;

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void signalPropertiesPassWhenAllFieldsValid() {
    final AttendanceSignalNatsProperties properties =
        new AttendanceSignalNatsProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);

    assertThat(validator.validate(properties)).isEmpty();
  }

  @Test
  void signalPropertiesFailWhenAckWaitIsZero() {
    final AttendanceSignalNatsProperties properties =
        new AttendanceSignalNatsProperties(
            SUBJECT, STREAM, DURABLE, DUPLICATE_WINDOW, Duration.ZERO, MAX_DELIVER);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void signalPropertiesFailWhenSubjectIsBlank() {
    final AttendanceSignalNatsProperties properties =
        new AttendanceSignalNatsProperties(
            " ", STREAM, DURABLE, DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void occasionChangePropertiesFailWhenMaxDeliverIsZero() {
    final OccasionChangeNatsProperties properties =
        new OccasionChangeNatsProperties(
            "reminder.occasion.changed",
            "REMINDER_OCCASION_CHANGES",
            "reminder-occasion-change",
            DUPLICATE_WINDOW,
            ACK_WAIT,
            0);

    assertThat(validator.validate(properties)).isNotEmpty();
  }

  @Test
  void occasionChangePropertiesFailWhenDuplicateWindowIsNegative() {
    final OccasionChangeNatsProperties properties =
        new OccasionChangeNatsProperties(
            "reminder.occasion.changed",
            "REMINDER_OCCASION_CHANGES",
            "reminder-occasion-change",
            Duration.ofSeconds(-1),
            ACK_WAIT,
            MAX_DELIVER);

    assertThat(validator.validate(properties)).isNotEmpty();
  }
}
