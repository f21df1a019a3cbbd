/*
 * どこで: Reminder サービス層
 * 何を: 朝の一覧・リード通知・開始通知を送信する
 * なぜ: 発火時点の予定を取り直して、削除/変更済みの予定へ通知しないため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.config.ReminderProperties;
import com.occasionbell.reminder.model.DailySummaryResult;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.OutboundMessage;
import com.occasionbell.reminder.model.SentMessage;
import com.occasionbell.reminder.model.Trigger;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ReminderNotifier {

  private static final Logger logger = LoggerFactory.getLogger(ReminderNotifier.class);

  private final OccasionSource occasionSource;
  private final NotificationSender notificationSender;
  private final AttendanceTracker attendanceTracker;
  private final MessageFormatter messageFormatter;
  private final ReminderProperties properties;
  private final ReminderMetrics metrics;
  private final Clock clock;

  /** @return {@code false} when the occasion vanished or moved since compilation */
  public boolean sendLead(Trigger trigger) {
    final Optional<Occasion> occasion = currentOccasion(trigger);
    if (occasion.isEmpty()) {
      return false;
    }
    send(
        new OutboundMessage(
            properties.announceLocationRef(),
            messageFormatter.leadNotification(occasion.get(), trigger.offsetMinutes()),
            audience(),
            List.of()));
    return true;
  }

  public boolean sendStart(Trigger trigger) {
    final Optional<Occasion> occasion = currentOccasion(trigger);
    if (occasion.isEmpty()) {
      return false;
    }
    send(
        new OutboundMessage(
            properties.announceLocationRef(),
            messageFormatter.startNotification(occasion.get()),
            audience(),
            List.of()));
    return true;
  }

  /**
   * Closes the current attendance cycle, then sends today's summary and opens a new cycle keyed by
   * the sent message. No message is sent when there are no occasions today.
   *
   * @throws NotificationSendException when the summary could not be delivered
   */
  public DailySummaryResult sendDailySummary() {
    final ZoneId zone = clock.getZone();
    final LocalDate today = LocalDate.now(clock);
    final List<Occasion> occasions =
        occasionSource.listUpcoming(
            today.atStartOfDay(zone).toInstant(), today.plusDays(1).atStartOfDay(zone).toInstant());

    attendanceTracker.closeCurrent();
    if (occasions.isEmpty()) {
      logger.info("daily summary skipped because there are no occasions today date={}", today);
      return DailySummaryResult.nothingToSend();
    }

    final SentMessage sent =
        send(
            new OutboundMessage(
                properties.announceLocationRef(),
                messageFormatter.dailySummary(occasions),
                null,
                List.of(MessageFormatter.OPT_IN_MARKER, MessageFormatter.OPT_OUT_MARKER)));
    attendanceTracker.newCycle(sent.messageRef(), sent.sentAt());
    logger.info("daily summary sent date={} occasions={} messageRef={}",
        today, occasions.size(), sent.messageRef());
    return new DailySummaryResult(true, occasions.size(), sent.messageRef());
  }

  private Optional<Occasion> currentOccasion(Trigger trigger) {
    final Occasion compiled = trigger.occasion();
    if (compiled == null) {
      throw new IllegalArgumentException("trigger has no occasion id=" + trigger.id());
    }
    final Optional<Occasion> found = occasionSource.find(compiled.occasionId());
    if (found.isEmpty()) {
      logger.info("notification skipped because occasion is gone triggerId={}", trigger.id());
      return Optional.empty();
    }
    final Instant startAt = found.get().startAt();
    if (!compiled.startAt().equals(startAt)) {
      logger.info("notification skipped because occasion moved triggerId={} from={} to={}",
          trigger.id(), compiled.startAt(), startAt);
      return Optional.empty();
    }
    return found;
  }

  private SentMessage send(OutboundMessage message) {
    try {
      final SentMessage sent = notificationSender.send(message);
      metrics.recordNotificationSend("sent");
      return sent;
    } catch (NotificationSendException ex) {
      metrics.recordNotificationSend("failed");
      throw ex;
    }
  }

  private String audience() {
    return properties.hasAudience() ? properties.audienceRef() : null;
  }
}
