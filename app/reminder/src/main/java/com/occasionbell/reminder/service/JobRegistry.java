/*
 * どこで: Reminder サービス層
 * 何を: 識別子 -> 登録済みタイマーの対応を一元管理し、必要トリガー集合へ差分で寄せる
 * なぜ: 同一識別子のタイマーを同時に 2 つ生かさないことを 1 箇所で保証するため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.model.ArmedTrigger;
import com.occasionbell.reminder.model.CompiledSchedule;
import com.occasionbell.reminder.model.ReconcileOutcome;
import com.occasionbell.reminder.model.Trigger;
import jakarta.annotation.PreDestroy;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Owns every armed timer of the process.
 *
 * <p>Reconciliation against a required trigger set arms missing triggers, re-arms triggers whose
 * fire instant changed, retires triggers no longer required and leaves everything else untouched.
 * Only the scopes a {@link CompiledSchedule} is authoritative for are pruned. Fired entries stay in
 * the map until a later reconciliation no longer requires them, so a trigger that already fired is
 * never armed again for the same instant.
 *
 * <p>Cancellation is not preemptive: a callback that is already running completes.
 */
@Component
public class JobRegistry {

  private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);

  private static final Comparator<ArmedTrigger> SNAPSHOT_ORDER =
      Comparator.comparing(ArmedTrigger::fireAt).thenComparing(ArmedTrigger::id);

  private final TaskScheduler taskScheduler;
  private final TriggerDispatcher dispatcher;
  private final ReminderMetrics metrics;

  private final ReentrantLock lock = new ReentrantLock();
  // lock で保護する
  private final Map<String, ArmedJob> jobs = new HashMap<>();
  private long appliedEpoch;

  public JobRegistry(
      TaskScheduler taskScheduler, TriggerDispatcher dispatcher, ReminderMetrics metrics) {
    this.taskScheduler = taskScheduler;
    this.dispatcher = dispatcher;
    this.metrics = metrics;
  }

  /** Reconciles every scope against {@code required} under the next epoch. */
  public ReconcileOutcome reconcile(Set<Trigger> required) {
    lock.lock();
    try {
      return apply(CompiledSchedule.full(appliedEpoch + 1, required));
    } finally {
      lock.unlock();
    }
  }

  /** Schedules compiled before the last applied epoch are ignored. */
  public ReconcileOutcome reconcile(CompiledSchedule schedule) {
    lock.lock();
    try {
      if (schedule.epoch() <= appliedEpoch) {
        logger.warn("stale schedule ignored epoch={} appliedEpoch={}",
            schedule.epoch(), appliedEpoch);
        return ReconcileOutcome.skipped(schedule.epoch());
      }
      return apply(schedule);
    } finally {
      lock.unlock();
    }
  }

  public List<ArmedTrigger> snapshot() {
    lock.lock();
    try {
      return jobs.values().stream().map(ArmedJob::view).sorted(SNAPSHOT_ORDER).toList();
    } finally {
      lock.unlock();
    }
  }

  public long appliedEpoch() {
    lock.lock();
    try {
      return appliedEpoch;
    } finally {
      lock.unlock();
    }
  }

  @PreDestroy
  public void shutdown() {
    lock.lock();
    try {
      jobs.values().forEach(ArmedJob::cancel);
      jobs.clear();
      metrics.updateArmedTriggers(0);
    } finally {
      lock.unlock();
    }
  }

  private ReconcileOutcome apply(CompiledSchedule schedule) {
    final Map<String, Trigger> required = new LinkedHashMap<>();
    for (Trigger trigger : schedule.triggers()) {
      if (!schedule.scopes().contains(trigger.scope())) {
        logger.warn("trigger outside schedule scopes ignored id={} scope={}",
            trigger.id(), trigger.scope());
        continue;
      }
      required.put(trigger.id(), trigger);
    }

    int cancelled = 0;
    final Iterator<Map.Entry<String, ArmedJob>> iterator = jobs.entrySet().iterator();
    while (iterator.hasNext()) {
      final ArmedJob job = iterator.next().getValue();
      if (!schedule.scopes().contains(job.trigger.scope())
          || required.containsKey(job.trigger.id())) {
        continue;
      }
      job.cancel();
      iterator.remove();
      cancelled++;
      logger.info("trigger retired id={} fireAt={} fired={}",
          job.trigger.id(), job.trigger.fireAt(), job.fired.get());
    }

    int armed = 0;
    int unchanged = 0;
    for (Trigger trigger : required.values()) {
      final ArmedJob existing = jobs.get(trigger.id());
      if (existing != null && existing.trigger.fireAt().equals(trigger.fireAt())) {
        existing.epoch = schedule.epoch();
        unchanged++;
        continue;
      }
      if (existing != null) {
        existing.cancel();
        cancelled++;
        logger.info("trigger moved id={} from={} to={}",
            trigger.id(), existing.trigger.fireAt(), trigger.fireAt());
      }
      jobs.put(trigger.id(), arm(trigger, schedule.epoch()));
      armed++;
    }

    appliedEpoch = schedule.epoch();
    metrics.updateArmedTriggers(pendingCount());
    logger.info("reconciled epoch={} armed={} cancelled={} unchanged={} total={}",
        schedule.epoch(), armed, cancelled, unchanged, jobs.size());
    return new ReconcileOutcome(schedule.epoch(), armed, cancelled, unchanged, true);
  }

  private ArmedJob arm(Trigger trigger, long epoch) {
    final ArmedJob job = new ArmedJob(trigger, epoch);
    job.future = taskScheduler.schedule(() -> fire(job), trigger.fireAt());
    logger.debug("trigger armed id={} fireAt={} expr={}",
        trigger.id(), trigger.fireAt(), trigger.recurrence());
    return job;
  }

  private void fire(ArmedJob job) {
    if (job.cancelled.get() || !job.fired.compareAndSet(false, true)) {
      return;
    }
    metrics.updateArmedTriggers(pendingCountLocked());
    logger.info("trigger fired id={} kind={} fireAt={}",
        job.trigger.id(), job.trigger.kind(), job.trigger.fireAt());
    dispatcher.dispatch(job.trigger);
  }

  private int pendingCount() {
    return (int) jobs.values().stream().filter(job -> !job.fired.get()).count();
  }

  private int pendingCountLocked() {
    lock.lock();
    try {
      return pendingCount();
    } finally {
      lock.unlock();
    }
  }

  private static final class ArmedJob {
    private final Trigger trigger;
    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile long epoch;
    private volatile ScheduledFuture<?> future;

    private ArmedJob(Trigger trigger, long epoch) {
      this.trigger = trigger;
      this.epoch = epoch;
    }

    private void cancel() {
      cancelled.set(true);
      final ScheduledFuture<?> current = future;
      if (current != null) {
        current.cancel(false);
      }
    }

    private ArmedTrigger view() {
      return new ArmedTrigger(
          trigger.id(), trigger.kind(), trigger.fireAt(), trigger.recurrence(), epoch, fired.get());
    }
  }
}
