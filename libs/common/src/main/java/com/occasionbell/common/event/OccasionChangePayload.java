/*
 * どこで: 共通イベント定義
 * 何を: 予定 (occasion) の作成/更新/削除通知の JSON ペイロード
 * なぜ: Event Source の変更を reminder の再計算契機として受け取るため
 */
package com.occasionbell.common.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OccasionChangePayload(
    String eventId,
    String occasionId,
    String changeType,
    String occurredAt) {}
