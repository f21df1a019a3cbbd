/*
 * どこで: Reminder NATS 購読
 * 何を: JetStream の stream 確保/durable 購読/ack・nak・term の共通処理
 * なぜ: シグナル購読と予定変更購読で再配信制御を揃えるため
 */
package com.occasionbell.reminder.nats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.occasionbell.reminder.config.JetStreamConsumerProperties;
import com.occasionbell.reminder.service.ReminderEventPermanentException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable push consumer with explicit acks.
 *
 * <p>Payloads that cannot be parsed, and handler failures marked permanent, are terminated.
 * Every other failure is nak'ed so JetStream redelivers it up to {@code max-deliver} times.
 *
 * @param <T> JSON payload type
 */
public abstract class AbstractJetStreamSubscriber<T> {

  private static final Logger logger = LoggerFactory.getLogger(AbstractJetStreamSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NATS Connection は外部管理の共有リソースで、防御的コピーが不可能なため")
  private final Connection connection;

  private final ObjectMapper objectMapper;
  private final JetStreamConsumerProperties properties;
  private final Class<T> payloadType;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  protected AbstractJetStreamSubscriber(
      Connection connection,
      ObjectMapper objectMapper,
      JetStreamConsumerProperties properties,
      Class<T> payloadType) {
    this.connection = connection;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.payloadType = payloadType;
  }

  /** Processes one payload; throw {@link ReminderEventPermanentException} to stop redelivery. */
  protected abstract void process(T payload);

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info("reminder subscriber started subject={} stream={} durable={}",
          properties.subject(), properties.stream(), properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    final byte[] data = message.getData();
    if (data == null || data.length == 0) {
      logger.warn("empty nats message payload subject={}", properties.subject());
      termSilently(message);
      return;
    }
    try {
      final T payload = objectMapper.readValue(data, payloadType);
      process(payload);
      message.ack();
    } catch (JsonProcessingException ex) {
      // payload 破損は再配信で回復しないため恒久的に TERM する
      logger.warn("failed to parse nats message payload subject={}", properties.subject(), ex);
      termSilently(message);
    } catch (IOException ex) {
      logger.warn("failed to read nats message payload subject={}", properties.subject(), ex);
      termSilently(message);
    } catch (ReminderEventPermanentException ex) {
      logger.warn("permanent failure while handling nats message subject={}",
          properties.subject(), ex);
      termSilently(message);
    } catch (RuntimeException ex) {
      // 不明な例外は取りこぼし回避のため再配信に倒す
      logger.warn("failed to handle nats message subject={}", properties.subject(), ex);
      nakSilently(message);
    }
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    // Nats-Msg-Id による重複排除を有効化するため stream を必ず作成する
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (ex.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR
          && ex.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info("reminder stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(), properties.subject(), properties.duplicateWindow());
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack nats message", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term nats message", ex);
    }
  }
}
