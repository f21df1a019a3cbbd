/*
 * どこで: Reminder サービス層
 * 何を: メモリ上に予定を保持するローカル実装
 * なぜ: チャット基盤なしでスケジュール計算と通知を動かすため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.model.Occasion;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "platform.enabled", havingValue = "false", matchIfMissing = true)
public class LocalOccasionSource implements OccasionSource {

  private static final Logger logger = LoggerFactory.getLogger(LocalOccasionSource.class);

  private final ConcurrentMap<String, Occasion> occasions = new ConcurrentHashMap<>();

  @Override
  public List<Occasion> listUpcoming(Instant from, Instant to) {
    return occasions.values().stream()
        .filter(occasion -> !occasion.startAt().isBefore(from) && occasion.startAt().isBefore(to))
        .sorted(Comparator.comparing(Occasion::startAt).thenComparing(Occasion::occasionId))
        .toList();
  }

  @Override
  public Optional<Occasion> find(String occasionId) {
    return Optional.ofNullable(occasions.get(occasionId));
  }

  public void put(Occasion occasion) {
    occasions.put(occasion.occasionId(), occasion);
    logger.info("local occasion stored occasionId={} startAt={}",
        occasion.occasionId(), occasion.startAt());
  }

  public boolean remove(String occasionId) {
    final boolean removed = occasions.remove(occasionId) != null;
    logger.info("local occasion removed occasionId={} removed={}", occasionId, removed);
    return removed;
  }
}
