/*
 * どこで: Reminder ワーカー
 * 何を: 自身のヘルスエンドポイントへ定期的に HTTP リクエストを送る
 * なぜ: 無通信で停止させるホスティング環境でもタイマーを生かし続けるため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.config.KeepAliveProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
@ConditionalOnProperty(name = "reminder.keep-alive.enabled", havingValue = "true")
public class KeepAliveWorker {

  private static final Logger logger = LoggerFactory.getLogger(KeepAliveWorker.class);

  private final RestClient restClient;
  private final KeepAliveProperties properties;

  public KeepAliveWorker(RestClient.Builder restClientBuilder, KeepAliveProperties properties) {
    this.restClient = restClientBuilder.build();
    this.properties = properties;
  }

  @Scheduled(
      fixedDelayString = "${reminder.keep-alive.interval:PT10M}",
      initialDelayString = "${reminder.keep-alive.interval:PT10M}")
  public void run() {
    ping();
  }

  public boolean ping() {
    try {
      final ResponseEntity<Void> response =
          restClient.get().uri(properties.url()).retrieve().toBodilessEntity();
      logger.info("keep-alive ping ok url={} status={}",
          properties.url(), response.getStatusCode().value());
      return true;
    } catch (RestClientException ex) {
      logger.warn("keep-alive ping failed url={} error={}", properties.url(), ex.getMessage());
      return false;
    }
  }
}
