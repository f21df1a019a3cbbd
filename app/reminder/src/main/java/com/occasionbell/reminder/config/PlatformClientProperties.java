/*
 * どこで: Reminder 設定
 * 何を: チャット基盤 API (予定一覧/在室/送信) の呼び出し設定を保持する
 * なぜ: 下流 URL とパスを外部化するため
 */
package com.occasionbell.reminder.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "platform")
public record PlatformClientProperties(
    boolean enabled,
    String baseUrl,
    String listOccasionsPath,
    String getOccasionPath,
    String membersPresentPath,
    String sendMessagePath) {

  public PlatformClientProperties {
    baseUrl = baseUrl == null ? "http://chat-platform:80" : baseUrl;
    listOccasionsPath =
        isBlank(listOccasionsPath) ? "/v1/groups/{groupRef}/occasions" : listOccasionsPath;
    getOccasionPath =
        isBlank(getOccasionPath) ? "/v1/groups/{groupRef}/occasions/{occasionId}" : getOccasionPath;
    membersPresentPath =
        isBlank(membersPresentPath)
            ? "/v1/groups/{groupRef}/locations/{locationRef}/members"
            : membersPresentPath;
    sendMessagePath =
        isBlank(sendMessagePath) ? "/v1/locations/{locationRef}/messages" : sendMessagePath;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
