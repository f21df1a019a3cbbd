/*
 * どこで: Reminder サービス層
 * 何を: 予定一覧の取得元 (Event Source) の抽象化
 * なぜ: チャット基盤実装とローカル実装を差し替えるため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.model.Occasion;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OccasionSource {

  /** Occasions starting in {@code [from, to)}. Malformed entries are dropped by the source. */
  List<Occasion> listUpcoming(Instant from, Instant to);

  /** Empty when the occasion no longer exists. */
  Optional<Occasion> find(String occasionId);
}
