/*
 * どこで: Reminder NATS 購読
 * 何を: 参加/不参加シグナル (リアクション) を購読しハンドラへ渡す
 * なぜ: 朝の一覧へのリアクションを参加サイクルへ反映するため
 */
package com.occasionbell.reminder.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.occasionbell.common.event.AttendanceSignalPayload;
import com.occasionbell.reminder.config.AttendanceSignalNatsProperties;
import com.occasionbell.reminder.service.AttendanceSignalHandler;
import io.nats.client.Connection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class AttendanceSignalSubscriber
    extends AbstractJetStreamSubscriber<AttendanceSignalPayload> {

  private final AttendanceSignalHandler signalHandler;

  public AttendanceSignalSubscriber(
      Connection connection,
      ObjectMapper objectMapper,
      AttendanceSignalNatsProperties properties,
      AttendanceSignalHandler signalHandler) {
    super(connection, objectMapper, properties, AttendanceSignalPayload.class);
    this.signalHandler = signalHandler;
  }

  @Override
  protected void process(AttendanceSignalPayload payload) {
    signalHandler.handle(payload);
  }
}
