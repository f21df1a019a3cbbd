package com.occasionbell.reminder.service;

import com.occasionbell.common.event.AttendanceSignalPayload;
import com.occasionbell.reminder.model.Signal;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AttendanceSignalHandler {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceSignalHandler.class);

  private final AttendanceTracker attendanceTracker;

  /**
   * Applies an inbound opt-in/opt-out signal. Redelivered signals are harmless because applying
   * the same signal twice leaves the attendance set unchanged.
   *
   * @throws ReminderEventPermanentException when the payload can never be applied
   */
  public boolean handle(AttendanceSignalPayload payload) {
    if (payload == null) {
      throw new ReminderEventPermanentException("attendance signal payload is empty");
    }
    if (isBlank(payload.notificationRef())) {
      throw new ReminderEventPermanentException("attendance signal notification_ref is missing");
    }
    if (isBlank(payload.subscriberId())) {
      throw new ReminderEventPermanentException("attendance signal subscriber_id is missing");
    }
    final Signal signal =
        Signal.parse(payload.signal())
            .orElseThrow(
                () ->
                    new ReminderEventPermanentException(
                        "attendance signal is unknown: " + payload.signal()));
    final boolean applied =
        attendanceTracker.apply(payload.notificationRef(), payload.subscriberId(), signal);
    if (!applied) {
      logger.info("attendance signal for inactive cycle skipped eventId={} notificationRef={}",
          payload.eventId(), payload.notificationRef());
    }
    return applied;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
