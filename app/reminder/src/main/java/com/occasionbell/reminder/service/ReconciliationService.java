/*
 * どこで: Reminder サービス層
 * 何を: 設定と予定一覧からトリガー集合を再計算し、JobRegistry へ適用する
 * なぜ: 起動時/設定変更/予定変更/日付境界の契機だけで再計算し、定期ポーリングをなくすため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.config.ReminderProperties;
import com.occasionbell.reminder.model.CompiledSchedule;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.ReconcileOutcome;
import com.occasionbell.reminder.model.ReminderSettings;
import com.occasionbell.reminder.model.SettingsChange;
import com.occasionbell.reminder.model.TimeWindow;
import com.occasionbell.reminder.model.Trigger;
import com.occasionbell.reminder.model.TriggerScope;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Rebuilds the armed trigger set.
 *
 * <p>A settings change and the reconcile that follows it run under one lock, so no other
 * reconcile interleaves between the write and the rebuild. When the occasion source cannot be
 * read, only durable triggers are reconciled and the armed occasion triggers are kept.
 */
@Service
public class ReconciliationService {

  private static final Logger logger = LoggerFactory.getLogger(ReconciliationService.class);

  private final SettingsStore settingsStore;
  private final OccasionSource occasionSource;
  private final ScheduleCompiler scheduleCompiler;
  private final JobRegistry jobRegistry;
  private final TaskScheduler taskScheduler;
  private final ReminderProperties properties;
  private final ReminderMetrics metrics;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  // lock で保護する
  private long epoch;
  // this で同期する
  private ScheduledFuture<?> pendingRequest;

  public ReconciliationService(
      SettingsStore settingsStore,
      OccasionSource occasionSource,
      ScheduleCompiler scheduleCompiler,
      JobRegistry jobRegistry,
      TaskScheduler taskScheduler,
      ReminderProperties properties,
      ReminderMetrics metrics,
      Clock clock) {
    this.settingsStore = settingsStore;
    this.occasionSource = occasionSource;
    this.scheduleCompiler = scheduleCompiler;
    this.jobRegistry = jobRegistry;
    this.taskScheduler = taskScheduler;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    reconcileNow("startup");
  }

  @EventListener
  public void onReconcileRequested(ReconcileRequestedEvent event) {
    reconcileNow(event.reason(), event.notBefore());
  }

  public ReconcileOutcome reconcileNow(String reason) {
    return reconcileNow(reason, null);
  }

  /**
   * Reconciles as of the later of the clock and {@code notBefore}, so a timer that runs early by
   * the wall clock still compiles past its own instant.
   */
  public ReconcileOutcome reconcileNow(String reason, Instant notBefore) {
    lock.lock();
    try {
      return reconcileLocked(reason, settingsStore.load(), compileTime(notBefore));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Validates and persists a settings change, then reconciles with the new settings.
   *
   * @throws SettingsValidationException when the change is rejected; nothing is written
   * @throws SettingsStoreException when the change could not be persisted
   */
  public SettingsChange applySettings(String reason, UnaryOperator<ReminderSettings> change) {
    lock.lock();
    try {
      final ReminderSettings current = settingsStore.load();
      final ReminderSettings updated = change.apply(current);
      settingsStore.save(updated);
      return new SettingsChange(updated, reconcileLocked(reason, updated, compileTime(null)));
    } finally {
      lock.unlock();
    }
  }

  /** Coalesces bursts of change notifications into one reconcile after the debounce delay. */
  public void requestReconcile(String reason) {
    synchronized (this) {
      if (pendingRequest != null && !pendingRequest.isDone()) {
        logger.debug("reconcile request coalesced reason={}", reason);
        return;
      }
      final Instant runAt = Instant.now(clock).plus(properties.reconcileDebounce());
      pendingRequest = taskScheduler.schedule(() -> runRequested(reason), runAt);
      logger.info("reconcile requested reason={} runAt={}", reason, runAt);
    }
  }

  private void runRequested(String reason) {
    synchronized (this) {
      pendingRequest = null;
    }
    try {
      reconcileNow(reason);
    } catch (RuntimeException ex) {
      logger.error("requested reconcile failed reason={}", reason, ex);
    }
  }

  private Instant compileTime(Instant notBefore) {
    final Instant now = Instant.now(clock);
    return notBefore != null && notBefore.isAfter(now) ? notBefore : now;
  }

  private ReconcileOutcome reconcileLocked(
      String reason, ReminderSettings settings, Instant now) {
    epoch = Math.max(epoch, jobRegistry.appliedEpoch()) + 1;
    final long nextEpoch = epoch;
    final TimeWindow window = scheduleCompiler.lookAheadWindow(now, settings);

    List<Occasion> occasions;
    Set<TriggerScope> scopes = EnumSet.allOf(TriggerScope.class);
    try {
      occasions = occasionSource.listUpcoming(window.from(), window.to());
    } catch (RuntimeException ex) {
      logger.warn("occasion source unavailable, reconciling durable triggers only reason={}",
          reason, ex);
      occasions = List.of();
      scopes = EnumSet.of(TriggerScope.DURABLE);
    }

    final Set<Trigger> triggers = scheduleCompiler.compile(now, occasions, settings);
    final ReconcileOutcome outcome =
        jobRegistry.reconcile(new CompiledSchedule(nextEpoch, triggers, scopes));
    metrics.recordReconcile(scopes.size() == TriggerScope.values().length ? "full" : "partial");
    logger.info("reconcile finished reason={} epoch={} occasions={} triggers={} armed={}"
            + " cancelled={} unchanged={}",
        reason, nextEpoch, occasions.size(), triggers.size(), outcome.armed(),
        outcome.cancelled(), outcome.unchanged());
    return outcome;
  }
}
