/*
 * どこで: Reminder サービス層
 * 何を: 開始後の在室監査 (出席表明者 - 在室メンバー) を行い、不在者を 1 通にまとめて報告する
 * なぜ: 出席表明したのに来ていない人を知らせるため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.client.PlatformIntegrationException;
import com.occasionbell.reminder.config.ReminderProperties;
import com.occasionbell.reminder.model.AuditResult;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.OutboundMessage;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PresenceAuditor {

  private static final Logger logger = LoggerFactory.getLogger(PresenceAuditor.class);

  private final OccasionSource occasionSource;
  private final PresenceSource presenceSource;
  private final AttendanceTracker attendanceTracker;
  private final NotificationSender notificationSender;
  private final MessageFormatter messageFormatter;
  private final ReminderProperties properties;
  private final ReminderMetrics metrics;

  /**
   * Audits one occasion. The occasion is fetched again so that deletions and location edits since
   * compilation are honoured; a vanished occasion or location is a skip, not a failure.
   */
  public AuditResult audit(String occasionId) {
    final Optional<Occasion> found = occasionSource.find(occasionId);
    if (found.isEmpty()) {
      logger.info("presence audit skipped because occasion is gone occasionId={}", occasionId);
      return AuditResult.of(AuditResult.Outcome.OCCASION_GONE);
    }
    final Occasion occasion = found.get();
    if (!occasion.presenceSupported()) {
      logger.info("presence audit skipped because location has no presence occasionId={} type={}",
          occasionId, occasion.locationType());
      return AuditResult.of(AuditResult.Outcome.UNSUPPORTED_LOCATION);
    }
    final List<String> attendees = attendanceTracker.attendees();
    if (attendees.isEmpty()) {
      logger.info("presence audit found no attendees occasionId={}", occasionId);
      return AuditResult.of(AuditResult.Outcome.NO_ATTENDEES);
    }

    final Set<String> present;
    try {
      present = presenceSource.membersPresent(occasion.locationRef());
    } catch (PlatformIntegrationException ex) {
      if (!ex.isNotFound()) {
        throw ex;
      }
      logger.info("presence audit skipped because location is gone occasionId={} locationRef={}",
          occasionId, occasion.locationRef());
      return AuditResult.of(AuditResult.Outcome.OCCASION_GONE);
    }

    final List<String> missing =
        attendees.stream().filter(subscriber -> !present.contains(subscriber)).distinct().sorted()
            .toList();
    if (missing.isEmpty()) {
      logger.info("presence audit all present occasionId={} attendees={}",
          occasionId, attendees.size());
      return AuditResult.of(AuditResult.Outcome.ALL_PRESENT);
    }

    metrics.recordAuditMissing(missing.size());
    notificationSender.send(
        OutboundMessage.plain(
            properties.announceLocationRef(), messageFormatter.presenceReport(occasion, missing)));
    logger.info("presence audit reported occasionId={} missing={}", occasionId, missing.size());
    return new AuditResult(AuditResult.Outcome.REPORTED, missing);
  }
}
