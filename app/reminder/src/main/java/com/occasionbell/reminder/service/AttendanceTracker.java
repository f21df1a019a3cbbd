/*
 * どこで: Reminder サービス層
 * 何を: 朝の一覧通知ごとの参加表明 (出席/欠席) を保持する状態機械
 * なぜ: 古いサイクルへの遅延シグナルが新しいサイクルを書き換えないようにするため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.model.AttendanceCycle;
import com.occasionbell.reminder.model.AttendanceSnapshot;
import com.occasionbell.reminder.model.CycleState;
import com.occasionbell.reminder.model.Signal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Attendance set of the current notification cycle.
 *
 * <p>A cycle is {@code OPEN} from {@link #newCycle} until {@link #closeCurrent} runs for the next
 * daily summary. Closing clears the set, so the reset happens once per cycle and before the next
 * summary is sent. Signals are applied only when they reference the open cycle's notification;
 * before the first cycle every signal is a no-op.
 */
@Component
public class AttendanceTracker {

  private static final Logger logger = LoggerFactory.getLogger(AttendanceTracker.class);

  private final ReentrantLock lock = new ReentrantLock();
  // lock で保護する
  private AttendanceCycle cycle;
  private final Map<String, Boolean> responses = new HashMap<>();

  public void closeCurrent() {
    lock.lock();
    try {
      if (cycle == null || cycle.state() == CycleState.CLOSED) {
        return;
      }
      logger.info("attendance cycle closed notificationRef={} optedIn={}",
          cycle.notificationRef(), countOptedIn());
      cycle = cycle.close();
      responses.clear();
    } finally {
      lock.unlock();
    }
  }

  public AttendanceCycle newCycle(String notificationRef, Instant openedAt) {
    Objects.requireNonNull(notificationRef, "notificationRef");
    lock.lock();
    try {
      if (cycle != null && cycle.state() == CycleState.OPEN) {
        logger.info("attendance cycle superseded notificationRef={}", cycle.notificationRef());
      }
      responses.clear();
      cycle = new AttendanceCycle(notificationRef, openedAt, CycleState.OPEN);
      logger.info("attendance cycle opened notificationRef={}", notificationRef);
      return cycle;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Applies one signal. Duplicate deliveries leave the state unchanged.
   *
   * @return {@code true} when the signal referenced the open cycle
   */
  public boolean apply(String notificationRef, String subscriberId, Signal signal) {
    lock.lock();
    try {
      if (cycle == null || !cycle.isOpenFor(notificationRef)) {
        logger.debug("attendance signal ignored notificationRef={} subscriberId={} signal={}",
            notificationRef, subscriberId, signal);
        return false;
      }
      final Boolean previous = responses.put(subscriberId, signal == Signal.OPT_IN);
      if (previous == null || previous != (signal == Signal.OPT_IN)) {
        logger.info("attendance updated notificationRef={} subscriberId={} signal={}",
            notificationRef, subscriberId, signal);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean optIn(String notificationRef, String subscriberId) {
    return apply(notificationRef, subscriberId, Signal.OPT_IN);
  }

  public boolean optOut(String notificationRef, String subscriberId) {
    return apply(notificationRef, subscriberId, Signal.OPT_OUT);
  }

  /** Opted-in subscribers of the open cycle, sorted; empty when no cycle is open. */
  public List<String> attendees() {
    lock.lock();
    try {
      return optedInSorted();
    } finally {
      lock.unlock();
    }
  }

  public Optional<AttendanceCycle> currentCycle() {
    lock.lock();
    try {
      return Optional.ofNullable(cycle);
    } finally {
      lock.unlock();
    }
  }

  public AttendanceSnapshot snapshot() {
    lock.lock();
    try {
      if (cycle == null) {
        return new AttendanceSnapshot(null, null, null, List.of());
      }
      return new AttendanceSnapshot(
          cycle.notificationRef(), cycle.openedAt(), cycle.state(), optedInSorted());
    } finally {
      lock.unlock();
    }
  }

  private List<String> optedInSorted() {
    final List<String> optedIn = new ArrayList<>();
    responses.forEach((subscriber, attending) -> {
      if (attending) {
        optedIn.add(subscriber);
      }
    });
    optedIn.sort(null);
    return List.copyOf(optedIn);
  }

  private long countOptedIn() {
    return responses.values().stream().filter(Boolean::booleanValue).count();
  }
}
