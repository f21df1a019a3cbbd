/*
 * どこで: Reminder API レスポンス DTO
 * 何を: 現在の通知設定を返す
 * なぜ: 管理コマンドの確認応答で設定値を表示するため
 */
package com.occasionbell.reminder.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.occasionbell.reminder.model.ReminderSettings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SettingsResponse(
    String dailyTime,
    List<Integer> leadOffsets,
    boolean startNotificationEnabled,
    int auditDelayMinutes) {

  public SettingsResponse {
    leadOffsets = List.copyOf(leadOffsets);
  }

  public static SettingsResponse from(ReminderSettings settings) {
    return new SettingsResponse(
        settings.formattedDailyTime(),
        settings.leadOffsets(),
        settings.startNotificationEnabled(),
        settings.auditDelayMinutes());
  }
}
