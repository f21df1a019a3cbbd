/*
 * どこで: Reminder サービス層
 * 何を: 管理コマンド (設定変更/朝の一覧の強制送信/一覧表示/登録状況) を実行する
 * なぜ: 入力検証 -> 永続化 -> 再計算 -> 確認応答 の順序を 1 箇所で守るため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.common.TraceIds;
import com.occasionbell.reminder.config.ReminderProperties;
import com.occasionbell.reminder.model.ArmedTrigger;
import com.occasionbell.reminder.model.AttendanceSnapshot;
import com.occasionbell.reminder.model.DailySummaryResult;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.ReminderSettings;
import com.occasionbell.reminder.model.SettingsChange;
import com.occasionbell.reminder.model.UpcomingOccasions;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AdminCommandService {

  private static final Logger logger = LoggerFactory.getLogger(AdminCommandService.class);

  private final ReconciliationService reconciliationService;
  private final SettingsStore settingsStore;
  private final ReminderNotifier notifier;
  private final OccasionSource occasionSource;
  private final MessageFormatter messageFormatter;
  private final JobRegistry jobRegistry;
  private final AttendanceTracker attendanceTracker;
  private final ReminderProperties properties;
  private final Clock clock;

  public ReminderSettings settings() {
    return settingsStore.load();
  }

  public SettingsChange setDailyTime(String rawTime) {
    final LocalTime dailyTime = ReminderSettings.parseDailyTime(rawTime);
    return apply("set-daily-time", current -> current.withDailyTime(dailyTime));
  }

  public SettingsChange setLeadOffsets(List<Integer> offsets) {
    final List<Integer> validated = ReminderSettings.validateLeadOffsets(offsets);
    return apply("set-lead-offsets", current -> current.withLeadOffsets(validated));
  }

  /** Replaces the offset list with one offset. */
  public SettingsChange setLeadOffset(Integer minutes) {
    if (minutes == null) {
      throw new SettingsValidationException("lead offset is required");
    }
    return setLeadOffsets(List.of(minutes));
  }

  public SettingsChange setStartNotification(boolean enabled) {
    return apply(
        "set-start-notification", current -> current.withStartNotificationEnabled(enabled));
  }

  public SettingsChange setAuditDelay(Integer minutes) {
    if (minutes == null) {
      throw new SettingsValidationException("audit delay is required");
    }
    ReminderSettings.validateAuditDelay(minutes);
    return apply("set-audit-delay", current -> current.withAuditDelayMinutes(minutes));
  }

  /**
   * Sends the daily summary now. Unlike the scheduled run, a delivery failure reaches the caller.
   */
  public DailySummaryResult forceDailySummary() {
    MDC.put("trace_id", TraceIds.newTraceId());
    try {
      final DailySummaryResult result = notifier.sendDailySummary();
      logger.info("forced daily summary finished sent={} occasions={}",
          result.sent(), result.occasionCount());
      return result;
    } finally {
      MDC.remove("trace_id");
    }
  }

  /** Occasions from the start of today over the listing horizon. */
  public UpcomingOccasions upcoming() {
    final Instant from = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
    final Instant to = from.plus(properties.listingHorizon());
    final List<Occasion> occasions = occasionSource.listUpcoming(from, to);
    return new UpcomingOccasions(from, to, occasions, messageFormatter.upcomingListing(occasions));
  }

  public List<ArmedTrigger> schedule() {
    return jobRegistry.snapshot();
  }

  public long appliedEpoch() {
    return jobRegistry.appliedEpoch();
  }

  public AttendanceSnapshot attendance() {
    return attendanceTracker.snapshot();
  }

  private SettingsChange apply(String command, UnaryOperator<ReminderSettings> change) {
    final SettingsChange result = reconciliationService.applySettings(command, change);
    logger.info("admin command applied command={} epoch={} armed={} cancelled={}",
        command, result.reconcile().epoch(), result.reconcile().armed(),
        result.reconcile().cancelled());
    return result;
  }
}
