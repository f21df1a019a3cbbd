/*
 * どこで: Reminder アプリの設定バインド
 * 何を: 通知先・一覧期間・再計算の debounce・スレッド数などを保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.occasionbell.reminder.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "reminder")
public record ReminderProperties(
    String settingsFile,
    Duration listingHorizon,
    String announceLocationRef,
    String audienceRef,
    String groupRef,
    Duration reconcileDebounce,
    String locationLinkTemplate,
    String occasionLinkTemplate,
    int timerPoolSize,
    int workerPoolSize) {

  public ReminderProperties {
    settingsFile = isBlank(settingsFile) ? "data/settings.json" : settingsFile;
    listingHorizon = listingHorizon == null ? Duration.ofDays(7) : listingHorizon;
    announceLocationRef = isBlank(announceLocationRef) ? "announce" : announceLocationRef;
    groupRef = groupRef == null ? "" : groupRef;
    reconcileDebounce = reconcileDebounce == null ? Duration.ofSeconds(2) : reconcileDebounce;
    locationLinkTemplate =
        isBlank(locationLinkTemplate)
            ? "https://discord.com/channels/{groupRef}/{locationRef}"
            : locationLinkTemplate;
    occasionLinkTemplate =
        isBlank(occasionLinkTemplate)
            ? "https://discord.com/events/{groupRef}/{occasionId}"
            : occasionLinkTemplate;
    timerPoolSize = timerPoolSize <= 0 ? 2 : timerPoolSize;
    workerPoolSize = workerPoolSize <= 0 ? 4 : workerPoolSize;
  }

  public boolean hasAudience() {
    return !isBlank(audienceRef);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
