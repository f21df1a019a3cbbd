package com.occasionbell.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.occasionbell.common.event.AttendanceSignalPayload;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AttendanceSignalHandlerTest {

  private AttendanceTracker tracker;
  private AttendanceSignalHandler handler;

  @BeforeEach
  void setUp() {
    tracker = new AttendanceTracker();
    tracker.newCycle("msg-1", Instant.parse("2024-05-01T22:00:00Z"));
    handler = new AttendanceSignalHandler(tracker);
  }

  @Test
  void redeliveredOptInIsAppliedOnce() {
    final AttendanceSignalPayload payload = payload("msg-1", "alice", "opt-in");

    assertThat(handler.handle(payload)).isTrue();
    assertThat(handler.handle(payload)).isTrue();

    assertThat(tracker.attendees()).containsExactly("alice");
  }

  @Test
  void signalForOtherNotificationIsSkipped() {
    assertThat(handler.handle(payload("msg-0", "alice", "OPT_IN"))).isFalse();
    assertThat(tracker.attendees()).isEmpty();
  }

  @Test
  void unknownSignalIsPermanentFailure() {
    assertThatThrownBy(() -> handler.handle(payload("msg-1", "alice", "maybe")))
        .isInstanceOf(ReminderEventPermanentException.class);
  }

  @Test
  void missingSubscriberIsPermanentFailure() {
    assertThatThrownBy(() -> handler.handle(payload("msg-1", " ", "opt-in")))
        .isInstanceOf(ReminderEventPermanentException.class)
        .hasMessageContaining("subscriber_id");
  }

  private static AttendanceSignalPayload payload(String ref, String subscriber, String signal) {
    return new AttendanceSignalPayload("evt-1", ref, subscriber, signal, "2024-05-01T22:01:00Z");
  }
}
