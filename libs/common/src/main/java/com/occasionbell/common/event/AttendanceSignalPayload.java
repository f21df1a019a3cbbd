/*
 * どこで: 共通イベント定義
 * 何を: 参加/不参加シグナル (リアクション) の JSON ペイロード
 * なぜ: チャット基盤側 publisher と reminder 側 subscriber で形を共有するため
 */
package com.occasionbell.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AttendanceSignalPayload(
    String eventId,
    String notificationRef,
    String subscriberId,
    String signal,
    String occurredAt) {}
