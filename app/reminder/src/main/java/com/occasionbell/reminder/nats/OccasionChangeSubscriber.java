/*
 * どこで: Reminder NATS 購読
 * 何を: 予定の作成/更新/削除通知を購読し再計算を要求する
 * なぜ: 新規予定や時刻変更を次の日付境界を待たずにトリガーへ反映するため
 */
package com.occasionbell.reminder.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.occasionbell.common.event.OccasionChangePayload;
import com.occasionbell.reminder.config.OccasionChangeNatsProperties;
import com.occasionbell.reminder.service.ReconciliationService;
import com.occasionbell.reminder.service.ReminderEventPermanentException;
import io.nats.client.Connection;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class OccasionChangeSubscriber extends AbstractJetStreamSubscriber<OccasionChangePayload> {

  private static final Logger logger = LoggerFactory.getLogger(OccasionChangeSubscriber.class);

  private final ReconciliationService reconciliationService;

  public OccasionChangeSubscriber(
      Connection connection,
      ObjectMapper objectMapper,
      OccasionChangeNatsProperties properties,
      ReconciliationService reconciliationService) {
    super(connection, objectMapper, properties, OccasionChangePayload.class);
    this.reconciliationService = reconciliationService;
  }

  @Override
  protected void process(OccasionChangePayload payload) {
    if (payload == null || payload.occasionId() == null || payload.occasionId().isBlank()) {
      throw new ReminderEventPermanentException("occasion change occasion_id is missing");
    }
    logger.info("occasion change received eventId={} occasionId={} changeType={}",
        payload.eventId(), payload.occasionId(), payload.changeType());
    final String changeType = payload.changeType() == null ? "change" : payload.changeType();
    reconciliationService.requestReconcile("occasion-" + changeType.toLowerCase(Locale.ROOT));
  }
}
