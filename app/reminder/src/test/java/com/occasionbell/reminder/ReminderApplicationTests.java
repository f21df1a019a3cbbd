/*
 * どこで: Reminder アプリのスモークテスト
 * 何を: Spring コンテキストの起動と、起動時の再計算で常設トリガーが登録されることを確認する
 * なぜ: 主要な構成が破壊されていないことを担保するため
 */
package com.occasionbell.reminder;

import static org.assertj.core.api.Assertions.assertThat;

import com.occasionbell.reminder.model.ArmedTrigger;
import com.occasionbell.reminder.model.LocationType;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.Trigger;
import com.occasionbell.reminder.service.AdminCommandService;
import com.occasionbell.reminder.service.LocalOccasionSource;
import com.occasionbell.reminder.service.ReconciliationService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ReminderApplicationTests {

  @Autowired private AdminCommandService adminCommandService;
  @Autowired private ReconciliationService reconciliationService;
  @Autowired private LocalOccasionSource occasionSource;
  @Autowired private Clock clock;

  @Test
  void startupReconcileArmsDurableTriggers() {
    assertThat(adminCommandService.schedule())
        .extracting(ArmedTrigger::id)
        .contains(Trigger.DAILY_SUMMARY_ID, Trigger.DAILY_RECONCILE_ID);
  }

  @Test
  void localOccasionIsScheduledAfterReconcile() {
    final Instant startAt =
        Instant.now(clock).plus(Duration.ofMinutes(30)).truncatedTo(ChronoUnit.SECONDS);
    occasionSource.put(
        new Occasion("smoke-1", "smoke", startAt, "vc-1", LocationType.VOICE, null, null));
    try {
      reconciliationService.reconcileNow("test");

      assertThat(adminCommandService.schedule())
          .extracting(ArmedTrigger::id)
          .contains(Trigger.leadId("smoke-1", 15), Trigger.auditId("smoke-1"));
    } finally {
      occasionSource.remove("smoke-1");
      reconciliationService.reconcileNow("test-cleanup");
    }
  }
}
