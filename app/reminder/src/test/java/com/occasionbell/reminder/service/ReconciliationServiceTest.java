/*
 * どこで: Reminder 再計算サービステスト
 * 何を: 設定変更→保存→再計算の流れ、予定取得失敗時の部分再計算、要求の集約を検証する
 * なぜ: 予定一覧が一時的に取れないだけで登録済みの通知が消える回帰を防ぐため
 */
package com.occasionbell.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.occasionbell.reminder.config.ReminderProperties;
import com.occasionbell.reminder.model.ArmedTrigger;
import com.occasionbell.reminder.model.LocationType;
import com.occasionbell.reminder.model.Occasion;
import com.occasionbell.reminder.model.ReconcileOutcome;
import com.occasionbell.reminder.model.ReminderSettings;
import com.occasionbell.reminder.model.SettingsChange;
import com.occasionbell.reminder.model.TimeWindow;
import com.occasionbell.reminder.model.Trigger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

  // 2024-05-01 09:00 JST
  private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
  private static final Occasion OCCASION =
      new Occasion(
          "o-1", "raid", Instant.parse("2024-05-01T03:00:00Z"), "vc-1", LocationType.VOICE,
          "g-1", "host");

  @Mock private SettingsStore settingsStore;
  @Mock private OccasionSource occasionSource;
  @Mock private TaskScheduler taskScheduler;
  @Mock private TriggerDispatcher dispatcher;

  private final List<Runnable> scheduledTasks = new ArrayList<>();
  private SimpleMeterRegistry meterRegistry;
  private JobRegistry jobRegistry;
  private ReminderMetrics metrics;
  private ReconciliationService service;

  @BeforeEach
  void setUp() {
    lenient()
        .when(taskScheduler.schedule(any(Runnable.class), any(Instant.class)))
        .thenAnswer(
            invocation -> {
              scheduledTasks.add(invocation.getArgument(0));
              return mock(ScheduledFuture.class);
            });
    meterRegistry = new SimpleMeterRegistry();
    metrics = new ReminderMetrics(meterRegistry);
    jobRegistry = new JobRegistry(taskScheduler, dispatcher, metrics);
    service = serviceAt(NOW);
  }

  @Test
  void fullReconcileArmsDurableAndOccasionTriggers() {
    when(settingsStore.load()).thenReturn(ReminderSettings.defaults());
    when(occasionSource.listUpcoming(
            Instant.parse("2024-04-30T14:50:00Z"), Instant.parse("2024-05-01T16:00:00Z")))
        .thenReturn(List.of(OCCASION));

    final ReconcileOutcome outcome = service.reconcileNow("test");

    assertThat(outcome.armed()).isEqualTo(5);
    assertThat(ids())
        .containsExactlyInAnyOrder(
            Trigger.DAILY_SUMMARY_ID,
            Trigger.DAILY_RECONCILE_ID,
            Trigger.leadId("o-1", 60),
            Trigger.leadId("o-1", 15),
            Trigger.auditId("o-1"));
    assertThat(meterRegistry.get("reminder.reconcile.total").tag("result", "full").counter()
            .count())
        .isEqualTo(1.0d);
  }

  @Test
  void sourceFailureKeepsArmedOccasionTriggers() {
    when(settingsStore.load()).thenReturn(ReminderSettings.defaults());
    when(occasionSource.listUpcoming(any(), any()))
        .thenReturn(List.of(OCCASION))
        .thenThrow(new IllegalStateException("source down"));

    service.reconcileNow("first");
    final ReconcileOutcome second = service.reconcileNow("second");

    assertThat(second.cancelled()).isZero();
    assertThat(ids()).contains(Trigger.leadId("o-1", 60), Trigger.auditId("o-1"));
    assertThat(meterRegistry.get("reminder.reconcile.total").tag("result", "partial").counter()
            .count())
        .isEqualTo(1.0d);
  }

  @Test
  void settingsChangeIsPersistedBeforeRebuild() {
    when(settingsStore.load()).thenReturn(ReminderSettings.defaults());
    when(occasionSource.listUpcoming(any(), any())).thenReturn(List.of(OCCASION));

    final SettingsChange change =
        service.applySettings("lead-offsets", settings -> settings.withLeadOffsets(List.of(30)));

    assertThat(change.settings().leadOffsets()).containsExactly(30);
    verify(settingsStore).save(change.settings());
    assertThat(ids()).contains(Trigger.leadId("o-1", 30)).doesNotContain(Trigger.leadId("o-1", 60));
    assertThat(change.reconcile().applied()).isTrue();
  }

  @Test
  void rejectedChangeWritesNothing() {
    when(settingsStore.load()).thenReturn(ReminderSettings.defaults());

    assertThatThrownBy(
            () -> service.applySettings("audit-delay", s -> s.withAuditDelayMinutes(0)))
        .isInstanceOf(SettingsValidationException.class);
    verify(settingsStore, never()).save(any());
    verify(occasionSource, never()).listUpcoming(any(), any());
  }

  @Test
  void epochsIncreaseAcrossRuns() {
    when(settingsStore.load()).thenReturn(ReminderSettings.defaults());
    when(occasionSource.listUpcoming(any(), any())).thenReturn(List.of());

    final long first = service.reconcileNow("a").epoch();
    final long second = service.reconcileNow("b").epoch();

    assertThat(second).isGreaterThan(first);
    assertThat(jobRegistry.appliedEpoch()).isEqualTo(second);
  }

  @Test
  void burstOfRequestsIsCoalescedIntoOneReconcile() {
    when(settingsStore.load()).thenReturn(ReminderSettings.defaults());
    when(occasionSource.listUpcoming(any(), any())).thenReturn(List.of());

    service.requestReconcile("occasion-created");
    service.requestReconcile("occasion-updated");

    verify(taskScheduler, times(1)).schedule(any(Runnable.class), eq(NOW.plusSeconds(2)));
    scheduledTasks.get(0).run();
    verify(occasionSource, times(1)).listUpcoming(any(), any());
  }

  @Test
  void failedRequestedReconcileIsContained() {
    when(settingsStore.load()).thenThrow(new SettingsStoreException("disk", new RuntimeException()));

    service.requestReconcile("occasion-deleted");
    scheduledTasks.get(0).run();

    assertThat(jobRegistry.snapshot()).isEmpty();
  }

  @Test
  void pendingAuditIsKeptByReconcileAfterMidnight() {
    // 2024-05-01 23:55 JST
    final Occasion late =
        new Occasion(
            "late", "late raid", Instant.parse("2024-05-01T14:55:00Z"), "vc-1",
            LocationType.VOICE, "g-1", "host");
    when(settingsStore.load()).thenReturn(ReminderSettings.defaults());
    when(occasionSource.listUpcoming(any(), any()))
        .thenAnswer(
            invocation ->
                new TimeWindow(invocation.getArgument(0), invocation.getArgument(1))
                        .contains(late.startAt())
                    ? List.of(late)
                    : List.of());

    serviceAt(Instant.parse("2024-05-01T14:56:00Z")).reconcileNow("before-midnight");
    serviceAt(Instant.parse("2024-05-01T15:00:00.001Z")).reconcileNow("daily-boundary");

    assertThat(jobRegistry.snapshot())
        .filteredOn(trigger -> trigger.id().equals(Trigger.auditId("late")))
        .singleElement()
        .satisfies(
            audit -> {
              assertThat(audit.fireAt()).isEqualTo(Instant.parse("2024-05-01T15:05:00Z"));
              assertThat(audit.fired()).isFalse();
            });
  }

  @Test
  void boundaryRebuildRunningEarlyArmsNextBoundary() {
    final Instant boundary = Instant.parse("2024-05-01T15:00:00Z");
    when(settingsStore.load()).thenReturn(ReminderSettings.defaults());
    when(occasionSource.listUpcoming(any(), any())).thenReturn(List.of());
    service.reconcileNow("startup");
    List.copyOf(scheduledTasks).forEach(Runnable::run);

    serviceAt(boundary.minusMillis(5))
        .onReconcileRequested(new ReconcileRequestedEvent("daily-boundary", boundary));

    assertThat(jobRegistry.snapshot())
        .filteredOn(trigger -> trigger.id().equals(Trigger.DAILY_RECONCILE_ID))
        .singleElement()
        .satisfies(
            next -> {
              assertThat(next.fireAt()).isEqualTo(Instant.parse("2024-05-02T15:00:00Z"));
              assertThat(next.fired()).isFalse();
            });
  }

  private ReconciliationService serviceAt(Instant now) {
    final Clock clock = Clock.fixed(now, ZoneId.of("Asia/Tokyo"));
    return new ReconciliationService(
        settingsStore,
        occasionSource,
        new ScheduleCompiler(clock),
        jobRegistry,
        taskScheduler,
        new ReminderProperties(null, null, null, null, null, null, null, null, 0, 0),
        metrics,
        clock);
  }

  private List<String> ids() {
    return jobRegistry.snapshot().stream().map(ArmedTrigger::id).toList();
  }
}
