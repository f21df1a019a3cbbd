/*
 * どこで: Reminder サービス層
 * 何を: 通知送信を模擬する実装
 * なぜ: 外部送信を伴わずにトリガー実行と参加サイクルを確認するため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.model.OutboundMessage;
import com.occasionbell.reminder.model.SentMessage;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "platform.enabled", havingValue = "false", matchIfMissing = true)
public class LocalNotificationSender implements NotificationSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotificationSender.class);
  private static final int HISTORY_LIMIT = 50;

  private final Clock clock;
  // this で同期する
  private final Deque<OutboundMessage> history = new ArrayDeque<>();

  public LocalNotificationSender(Clock clock) {
    this.clock = clock;
  }

  @Override
  public SentMessage send(OutboundMessage message) {
    final String messageRef = "local-" + UUID.randomUUID();
    // 実送信は行わず、ログに残すだけとする
    logger.info("notification simulated send messageRef={} locationRef={} audienceRef={} content={}",
        messageRef, message.locationRef(), message.audienceRef(), message.content());
    synchronized (this) {
      history.addFirst(message);
      while (history.size() > HISTORY_LIMIT) {
        history.removeLast();
      }
    }
    return new SentMessage(messageRef, Instant.now(clock));
  }

  /** Most recent first. */
  public synchronized List<OutboundMessage> recent() {
    return List.copyOf(history);
  }
}
