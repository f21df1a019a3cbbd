/*
 * どこで: Reminder サービス層
 * 何を: トリガー実行結果/登録数/再計算/送信/在室監査のメトリクスを記録する
 * なぜ: バックグラウンド実行の失敗をログ以外からも観測できるようにするため
 */
package com.occasionbell.reminder.service;

import com.occasionbell.reminder.model.TriggerKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ReminderMetrics {

  private static final String METRIC_TRIGGER_EXECUTIONS = "reminder.trigger.executions";
  private static final String METRIC_TRIGGERS_ARMED = "reminder.triggers.armed";
  private static final String METRIC_RECONCILE_TOTAL = "reminder.reconcile.total";
  private static final String METRIC_NOTIFICATION_SEND = "reminder.notification.send";
  private static final String METRIC_AUDIT_MISSING = "reminder.audit.missing";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger armedTriggers = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter auditMissingCounter;

  public ReminderMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_TRIGGERS_ARMED, armedTriggers, AtomicInteger::get)
        .description("Number of triggers currently armed and not yet fired")
        .register(meterRegistry);
    this.auditMissingCounter =
        Counter.builder(METRIC_AUDIT_MISSING)
            .description("Opted-in subscribers not present when the audit ran")
            .register(meterRegistry);
  }

  public void recordTriggerExecution(TriggerKind kind, String result) {
    counter(METRIC_TRIGGER_EXECUTIONS, "Trigger execution outcomes",
            Tags.of("kind", kind.tagValue(), "result", result))
        .increment();
  }

  public void recordReconcile(String result) {
    counter(METRIC_RECONCILE_TOTAL, "Reconciliation outcomes", Tags.of("result", result))
        .increment();
  }

  public void recordNotificationSend(String result) {
    counter(METRIC_NOTIFICATION_SEND, "Notification send outcomes", Tags.of("result", result))
        .increment();
  }

  public void recordAuditMissing(int missingCount) {
    auditMissingCounter.increment(Math.max(missingCount, 0));
  }

  public void updateArmedTriggers(int count) {
    armedTriggers.set(Math.max(count, 0));
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
