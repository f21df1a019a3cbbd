/*
 * どこで: Reminder クライアント層
 * 何を: チャット基盤から開催場所の在室メンバーを取得する
 * なぜ: 在室監査で出席表明者と突き合わせるため
 */
package com.occasionbell.reminder.client;

import com.occasionbell.reminder.client.dto.PresenceResponse;
import com.occasionbell.reminder.config.PlatformClientProperties;
import com.occasionbell.reminder.config.ReminderProperties;
import com.occasionbell.reminder.service.PresenceSource;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@ConditionalOnProperty(name = "platform.enabled", havingValue = "true")
public class PlatformPresenceSource implements PresenceSource {

  private static final String OPERATION = "membersPresent";

  private final RestClient platformRestClient;
  private final PlatformClientProperties properties;
  private final String groupRef;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public PlatformPresenceSource(
      RestClient platformRestClient,
      PlatformClientProperties properties,
      ReminderProperties reminderProperties) {
    this.platformRestClient = platformRestClient;
    this.properties = properties;
    this.groupRef = reminderProperties.groupRef();
  }

  /**
   * @throws PlatformIntegrationException with {@code NOT_FOUND} when the location is gone
   */
  @Override
  public Set<String> membersPresent(String locationRef) {
    if (locationRef == null || locationRef.isBlank()) {
      throw new IllegalArgumentException("locationRef is required");
    }
    final PresenceResponse response;
    try {
      response =
          platformRestClient
              .get()
              .uri(properties.membersPresentPath(), groupRef, locationRef)
              .retrieve()
              .body(PresenceResponse.class);
    } catch (RestClientResponseException ex) {
      throw PlatformCallErrors.fromResponse(OPERATION, ex);
    } catch (ResourceAccessException ex) {
      throw PlatformCallErrors.fromResource(OPERATION, ex);
    } catch (RuntimeException ex) {
      throw PlatformCallErrors.invalid(OPERATION, ex);
    }
    if (response == null || response.memberIds() == null) {
      throw PlatformCallErrors.invalid(OPERATION);
    }
    return Set.copyOf(response.memberIds());
  }
}
