/*
 * どこで: Reminder クライアント層
 * 何を: チャット基盤のメッセージ送信 API を呼び出す
 * なぜ: 通知を告知チャンネルへ投稿し、参加表明の対象となるメッセージ参照を得るため
 */
package com.occasionbell.reminder.client;

import com.occasionbell.reminder.client.dto.SendMessageRequest;
import com.occasionbell.reminder.client.dto.SendMessageResponse;
import com.occasionbell.reminder.config.PlatformClientProperties;
import com.occasionbell.reminder.model.OutboundMessage;
import com.occasionbell.reminder.model.SentMessage;
import com.occasionbell.reminder.service.NotificationSendException;
import com.occasionbell.reminder.service.NotificationSender;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@ConditionalOnProperty(name = "platform.enabled", havingValue = "true")
public class PlatformNotificationSender implements NotificationSender {

  private static final String OPERATION = "sendMessage";

  private final RestClient platformRestClient;
  private final PlatformClientProperties properties;
  private final Clock clock;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public PlatformNotificationSender(
      RestClient platformRestClient, PlatformClientProperties properties, Clock clock) {
    this.platformRestClient = platformRestClient;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public SentMessage send(OutboundMessage message) {
    final SendMessageResponse response;
    try {
      response =
          platformRestClient
              .post()
              .uri(properties.sendMessagePath(), message.locationRef())
              .contentType(MediaType.APPLICATION_JSON)
              .body(
                  new SendMessageRequest(
                      message.content(), message.audienceRef(), message.reactions()))
              .retrieve()
              .body(SendMessageResponse.class);
    } catch (RestClientResponseException ex) {
      throw new NotificationSendException(
          "notification send failed", PlatformCallErrors.fromResponse(OPERATION, ex));
    } catch (ResourceAccessException ex) {
      throw new NotificationSendException(
          "notification send failed", PlatformCallErrors.fromResource(OPERATION, ex));
    } catch (RuntimeException ex) {
      throw new NotificationSendException(
          "notification send failed", PlatformCallErrors.invalid(OPERATION, ex));
    }
    if (response == null || response.messageRef() == null || response.messageRef().isBlank()) {
      throw new NotificationSendException(
          "notification send failed", PlatformCallErrors.invalid(OPERATION));
    }
    return new SentMessage(response.messageRef(), sentAt(response));
  }

  private Instant sentAt(SendMessageResponse response) {
    if (response.sentAt() == null) {
      return Instant.now(clock);
    }
    try {
      return OffsetDateTime.parse(response.sentAt()).toInstant();
    } catch (DateTimeParseException ex) {
      return Instant.now(clock);
    }
  }
}
