/*
 * どこで: Reminder クライアント層
 * 何を: チャット基盤の予定 API から予定一覧/単一予定を取得する
 * なぜ: スケジュール計算と発火時の再確認に最新の予定を使うため
 */
package com.occasionbell.reminder.client;

import com.occasionbell.reminder.client.dto.OccasionItem;
import com.occasionbell.reminder.client.dto.OccasionListResponse;
import com.occasionbell.reminder.config.PlatformClientProperties;
import com.occasionbell.reminder.config.ReminderProperties;
import com.occasionbell.reminder.model.LocationType;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.service.OccasionSource;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
@ConditionalOnProperty(name = "platform.enabled", havingValue = "true")
public class PlatformOccasionSource implements OccasionSource {

  private static final Logger logger = LoggerFactory.getLogger(PlatformOccasionSource.class);
  private static final String OPERATION_LIST = "listOccasions";
  private static final String OPERATION_GET = "getOccasion";

  private final RestClient platformRestClient;
  private final PlatformClientProperties properties;
  private final String groupRef;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public PlatformOccasionSource(
      RestClient platformRestClient,
      PlatformClientProperties properties,
      ReminderProperties reminderProperties) {
    this.platformRestClient = platformRestClient;
    this.properties = properties;
    this.groupRef = reminderProperties.groupRef();
  }

  @Override
  public List<Occasion> listUpcoming(Instant from, Instant to) {
    final OccasionListResponse response;
    try {
      response =
          platformRestClient
              .get()
              .uri(
                  builder ->
                      builder
                          .path(properties.listOccasionsPath())
                          .queryParam("from", from.toString())
                          .queryParam("to", to.toString())
                          .build(groupRef))
              .retrieve()
              .body(OccasionListResponse.class);
    } catch (RestClientResponseException ex) {
      throw PlatformCallErrors.fromResponse(OPERATION_LIST, ex);
    } catch (ResourceAccessException ex) {
      throw PlatformCallErrors.fromResource(OPERATION_LIST, ex);
    } catch (RuntimeException ex) {
      throw PlatformCallErrors.invalid(OPERATION_LIST, ex);
    }
    if (response == null || response.items() == null) {
      throw PlatformCallErrors.invalid(OPERATION_LIST);
    }

    final List<Occasion> occasions = new ArrayList<>();
    for (OccasionItem item : response.items()) {
      toOccasion(item)
          .filter(occasion -> !occasion.startAt().isBefore(from) && occasion.startAt().isBefore(to))
          .ifPresent(occasions::add);
    }
    return occasions;
  }

  @Override
  public Optional<Occasion> find(String occasionId) {
    final OccasionItem item;
    try {
      item =
          platformRestClient
              .get()
              .uri(properties.getOccasionPath(), groupRef, occasionId)
              .retrieve()
              .body(OccasionItem.class);
    } catch (RestClientResponseException ex) {
      final PlatformIntegrationException mapped = PlatformCallErrors.fromResponse(OPERATION_GET, ex);
      if (mapped.isNotFound()) {
        return Optional.empty();
      }
      throw mapped;
    } catch (ResourceAccessException ex) {
      throw PlatformCallErrors.fromResource(OPERATION_GET, ex);
    } catch (RuntimeException ex) {
      throw PlatformCallErrors.invalid(OPERATION_GET, ex);
    }
    if (item == null) {
      throw PlatformCallErrors.invalid(OPERATION_GET);
    }
    final Optional<Occasion> occasion = toOccasion(item);
    if (occasion.isEmpty()) {
      throw PlatformCallErrors.invalid(OPERATION_GET);
    }
    return occasion;
  }

  // 不正な要素は全体を失敗させずに読み飛ばす
  private Optional<Occasion> toOccasion(OccasionItem item) {
    if (item == null || isBlank(item.id())) {
      logger.warn("occasion item skipped because id is missing");
      return Optional.empty();
    }
    final Instant startAt;
    try {
      startAt = OffsetDateTime.parse(isBlank(item.startAt()) ? "" : item.startAt()).toInstant();
    } catch (DateTimeParseException ex) {
      logger.warn("occasion item skipped because start is invalid occasionId={} startAt={}",
          item.id(), item.startAt());
      return Optional.empty();
    }
    return Optional.of(
        new Occasion(
            item.id(),
            isBlank(item.name()) ? item.id() : item.name(),
            startAt,
            item.locationRef(),
            parseLocationType(item),
            isBlank(item.groupRef()) ? groupRef : item.groupRef(),
            item.hostName()));
  }

  private LocationType parseLocationType(OccasionItem item) {
    if (isBlank(item.locationType())) {
      return LocationType.EXTERNAL;
    }
    try {
      return LocationType.valueOf(item.locationType().trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      logger.warn("unknown location type treated as external occasionId={} type={}",
          item.id(), item.locationType());
      return LocationType.EXTERNAL;
    }
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
