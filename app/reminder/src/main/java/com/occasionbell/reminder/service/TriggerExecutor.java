/*
 * どこで: Reminder サービス層
 * 何を: 発火したトリガーをワーカープールへ渡し、種別ごとのアクションを実行する
 * なぜ: 1 トリガーの失敗や遅い外部 I/O が他のタイマーへ波及しないようにするため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.common.TraceIds;
import com.occasionbell.reminder.model.Trigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Runs trigger actions off the timer threads.
 *
 * <p>Every failure is caught here, logged with the trigger id and counted; nothing is retried.
 * The daily boundary rebuild is requested through an application event so that this class does
 * not depend on the reconciliation service that in turn owns the registry.
 */
@Component
public class TriggerExecutor implements TriggerDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(TriggerExecutor.class);

  static final String MDC_TRACE_ID = "trace_id";
  static final String MDC_TRIGGER_ID = "trigger_id";

  private final TaskExecutor workerExecutor;
  private final ReminderNotifier notifier;
  private final PresenceAuditor presenceAuditor;
  private final ApplicationEventPublisher eventPublisher;
  private final ReminderMetrics metrics;

  public TriggerExecutor(
      @Qualifier("triggerWorkerExecutor") TaskExecutor workerExecutor,
      ReminderNotifier notifier,
      PresenceAuditor presenceAuditor,
      ApplicationEventPublisher eventPublisher,
      ReminderMetrics metrics) {
    this.workerExecutor = workerExecutor;
    this.notifier = notifier;
    this.presenceAuditor = presenceAuditor;
    this.eventPublisher = eventPublisher;
    this.metrics = metrics;
  }

  @Override
  public void dispatch(Trigger trigger) {
    try {
      workerExecutor.execute(() -> execute(trigger));
    } catch (TaskRejectedException ex) {
      metrics.recordTriggerExecution(trigger.kind(), "rejected");
      logger.error("trigger rejected by worker pool id={} kind={}", trigger.id(), trigger.kind(), ex);
    }
  }

  public void execute(Trigger trigger) {
    MDC.put(MDC_TRACE_ID, TraceIds.newTraceId());
    MDC.put(MDC_TRIGGER_ID, trigger.id());
    try {
      final boolean performed = perform(trigger);
      metrics.recordTriggerExecution(trigger.kind(), performed ? "success" : "skipped");
      logger.info("trigger executed id={} kind={} performed={}",
          trigger.id(), trigger.kind(), performed);
    } catch (RuntimeException ex) {
      metrics.recordTriggerExecution(trigger.kind(), "failed");
      logger.error("trigger failed id={} kind={}", trigger.id(), trigger.kind(), ex);
    } finally {
      MDC.remove(MDC_TRIGGER_ID);
      MDC.remove(MDC_TRACE_ID);
    }
  }

  private boolean perform(Trigger trigger) {
    switch (trigger.kind()) {
      case LEAD_NOTIFICATION:
        return notifier.sendLead(trigger);
      case START_NOTIFICATION:
        return notifier.sendStart(trigger);
      case DAILY_SUMMARY:
        return notifier.sendDailySummary().sent();
      case PRESENCE_AUDIT:
        presenceAuditor.audit(trigger.occasion().occasionId());
        return true;
      case DAILY_RECONCILE:
        eventPublisher.publishEvent(
            new ReconcileRequestedEvent("daily-boundary", trigger.fireAt()));
        return true;
      default:
        throw new IllegalStateException("unsupported trigger kind " + trigger.kind());
    }
  }
}
