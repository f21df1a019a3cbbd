/*
 * どこで: Reminder API
 * 何を: 管理コマンド (設定変更/朝の一覧の強制送信/一覧/登録状況/疎通確認) を公開する
 * なぜ: チャットのスラッシュコマンドに相当する操作を HTTP から行うため
 */
package com.occasionbell.reminder.api;

import com.occasionbell.reminder.api.request.AuditDelayRequest;
import com.occasionbell.reminder.api.request.DailyTimeRequest;
import com.occasionbell.reminder.api.request.LeadOffsetRequest;
import com.occasionbell.reminder.api.request.LeadOffsetsRequest;
import com.occasionbell.reminder.api.request.StartNotificationRequest;
import com.occasionbell.reminder.api.response.OccasionResponse;
import com.occasionbell.reminder.api.response.ScheduleResponse;
import com.occasionbell.reminder.api.response.SettingsChangeResponse;
import com.occasionbell.reminder.api.response.SettingsResponse;
import com.occasionbell.reminder.api.response.UpcomingOccasionsResponse;
import com.occasionbell.reminder.model.AttendanceSnapshot;
import com.occasionbell.reminder.model.DailySummaryResult;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.SettingsChange;
import com.occasionbell.reminder.model.UpcomingOccasions;
import com.occasionbell.reminder.service.AdminCommandService;
import com.occasionbell.reminder.service.MessageFormatter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
public class AdminController {

  private final AdminCommandService adminCommandService;
  private final MessageFormatter messageFormatter;

  @GetMapping("/ping")
  public String ping() {
    return "Pong!";
  }

  @GetMapping("/settings")
  public ResponseEntity<SettingsResponse> settings() {
    return ResponseEntity.ok(SettingsResponse.from(adminCommandService.settings()));
  }

  @PutMapping("/settings/daily-time")
  public ResponseEntity<SettingsChangeResponse> setDailyTime(
      @Valid @RequestBody DailyTimeRequest request) {
    final SettingsChange change = adminCommandService.setDailyTime(request.time());
    return ResponseEntity.ok(
        SettingsChangeResponse.from(
            "daily summary time set to " + change.settings().formattedDailyTime(), change));
  }

  @PutMapping("/settings/lead-offsets")
  public ResponseEntity<SettingsChangeResponse> setLeadOffsets(
      @Valid @RequestBody LeadOffsetsRequest request) {
    final SettingsChange change = adminCommandService.setLeadOffsets(request.minutes());
    return ResponseEntity.ok(
        SettingsChangeResponse.from(
            "lead offsets set to " + change.settings().leadOffsets(), change));
  }

  @PutMapping("/settings/lead-offset")
  public ResponseEntity<SettingsChangeResponse> setLeadOffset(
      @Valid @RequestBody LeadOffsetRequest request) {
    final SettingsChange change = adminCommandService.setLeadOffset(request.minutes());
    return ResponseEntity.ok(
        SettingsChangeResponse.from(
            "lead offset set to " + request.minutes() + " minutes", change));
  }

  @PutMapping("/settings/start-notification")
  public ResponseEntity<SettingsChangeResponse> setStartNotification(
      @Valid @RequestBody StartNotificationRequest request) {
    final SettingsChange change = adminCommandService.setStartNotification(request.enabled());
    return ResponseEntity.ok(
        SettingsChangeResponse.from(
            "start notification " + (request.enabled() ? "enabled" : "disabled"), change));
  }

  @PutMapping("/settings/audit-delay")
  public ResponseEntity<SettingsChangeResponse> setAuditDelay(
      @Valid @RequestBody AuditDelayRequest request) {
    final SettingsChange change = adminCommandService.setAuditDelay(request.minutes());
    return ResponseEntity.ok(
        SettingsChangeResponse.from(
            "presence audit delay set to " + change.settings().auditDelayMinutes() + " minutes",
            change));
  }

  @PostMapping("/daily-summary")
  public ResponseEntity<DailySummaryResult> forceDailySummary() {
    return ResponseEntity.ok(adminCommandService.forceDailySummary());
  }

  @GetMapping("/occasions/upcoming")
  public ResponseEntity<UpcomingOccasionsResponse> upcoming() {
    final UpcomingOccasions listing = adminCommandService.upcoming();
    return ResponseEntity.ok(
        new UpcomingOccasionsResponse(
            listing.from(),
            listing.to(),
            listing.occasions().stream().map(this::toResponse).toList(),
            listing.content()));
  }

  @GetMapping("/schedule")
  public ResponseEntity<ScheduleResponse> schedule() {
    return ResponseEntity.ok(
        new ScheduleResponse(adminCommandService.appliedEpoch(), adminCommandService.schedule()));
  }

  @GetMapping("/attendance")
  public ResponseEntity<AttendanceSnapshot> attendance() {
    return ResponseEntity.ok(adminCommandService.attendance());
  }

  private OccasionResponse toResponse(Occasion occasion) {
    return new OccasionResponse(
        occasion.occasionId(),
        occasion.name(),
        occasion.startAt(),
        occasion.locationRef(),
        occasion.locationType(),
        occasion.hostName(),
        occasion.locationRef() == null ? null : messageFormatter.locationLink(occasion),
        messageFormatter.occasionLink(occasion));
  }
}
