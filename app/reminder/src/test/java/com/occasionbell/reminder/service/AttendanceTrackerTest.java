/*
 * どこで: Reminder 参加サイクルテスト
 * 何を: サイクル分離/初回前の無視/重複シグナルの冪等性を検証する
 * なぜ: 古い朝の一覧へのリアクションが新しいサイクルを汚さないことを保証するため
 */
package com.occasionbell.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.occasionbell.reminder.model.AttendanceSnapshot;
import com.occasionbell.reminder.model.CycleState;
import com.occasionbell.reminder.model.Signal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AttendanceTrackerTest {

  private static final Instant OPENED_AT = Instant.parse("2024-05-01T22:00:00Z");

  private final AttendanceTracker tracker = new AttendanceTracker();

  @Test
  void signalsBeforeFirstCycleAreIgnored() {
    assertThat(tracker.optIn("msg-1", "alice")).isFalse();
    assertThat(tracker.attendees()).isEmpty();
    assertThat(tracker.currentCycle()).isEmpty();
  }

  @Test
  void optInAndOptOutApplyToOpenCycle() {
    tracker.newCycle("msg-1", OPENED_AT);

    tracker.optIn("msg-1", "carol");
    tracker.optIn("msg-1", "alice");
    tracker.optIn("msg-1", "bob");
    tracker.optOut("msg-1", "bob");

    assertThat(tracker.attendees()).containsExactly("alice", "carol");
  }

  @Test
  void signalForSupersededCycleHasNoEffect() {
    tracker.newCycle("msg-1", OPENED_AT);
    tracker.optIn("msg-1", "alice");
    tracker.closeCurrent();
    tracker.newCycle("msg-2", OPENED_AT.plusSeconds(86_400));

    final boolean applied = tracker.optIn("msg-1", "bob");

    assertThat(applied).isFalse();
    assertThat(tracker.attendees()).isEmpty();
  }

  @Test
  void duplicateSignalIsIdempotent() {
    tracker.newCycle("msg-1", OPENED_AT);

    tracker.apply("msg-1", "alice", Signal.OPT_IN);
    tracker.apply("msg-1", "alice", Signal.OPT_IN);

    assertThat(tracker.attendees()).containsExactly("alice");
  }

  @Test
  void closingClearsSetAndRejectsFurtherSignals() {
    tracker.newCycle("msg-1", OPENED_AT);
    tracker.optIn("msg-1", "alice");

    tracker.closeCurrent();

    assertThat(tracker.optIn("msg-1", "bob")).isFalse();
    final AttendanceSnapshot snapshot = tracker.snapshot();
    assertThat(snapshot.state()).isEqualTo(CycleState.CLOSED);
    assertThat(snapshot.notificationRef()).isEqualTo("msg-1");
    assertThat(snapshot.optedIn()).isEmpty();
  }

  @Test
  void closingTwiceIsHarmless() {
    tracker.closeCurrent();
    tracker.newCycle("msg-1", OPENED_AT);
    tracker.closeCurrent();
    tracker.closeCurrent();

    assertThat(tracker.currentCycle()).hasValueSatisfying(
        cycle -> assertThat(cycle.state()).isEqualTo(CycleState.CLOSED));
  }
}
