package com.audiencemanager.unit.materialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.audiencemanager.catalog.SegmentCatalogService;
import com.audiencemanager.config.MaterializationConfig;
import com.audiencemanager.domain.enums.RefreshSchedule;
import com.audiencemanager.domain.enums.RunStatus;
import com.audiencemanager.domain.enums.RunTrigger;
import com.audiencemanager.domain.enums.SetOperation;
import com.audiencemanager.domain.model.MaterializationRun;
import com.audiencemanager.domain.model.Rule;
import com.audiencemanager.event.RuleEvent;
import com.audiencemanager.event.RuleEventType;
import com.audiencemanager.materialization.ExecutionOrderPlanner;
import com.audiencemanager.materialization.MaterializationExecutor;
import com.audiencemanager.materialization.MaterializationScheduler;
import com.audiencemanager.materialization.RuleLocks;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

/**
 * Tests for MaterializationScheduler: job slot registration, rescheduling after success
 * and failure, overlap protection, manual triggers and dependency-ordered refreshes.
 * Jobs are captured from the mocked TaskScheduler and run inline.
 */
@ExtendWith(MockitoExtension.class)
class MaterializationSchedulerTest {

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private MaterializationExecutor materializationExecutor;

    @Mock
    private SegmentCatalogService segmentCatalogService;

    private ScheduledFuture<?> future;
    private MaterializationConfig materializationConfig;
    private RuleLocks ruleLocks;
    private MaterializationScheduler materializationScheduler;

    @BeforeEach
    void setUp() {
        future = mock(ScheduledFuture.class);
        materializationConfig = new MaterializationConfig();
        materializationConfig.setRetryDelay(Duration.ofMinutes(5));
        ruleLocks = new RuleLocks();
        materializationScheduler = new MaterializationScheduler(
                taskScheduler,
                materializationExecutor,
                segmentCatalogService,
                new ExecutionOrderPlanner(),
                materializationConfig,
                ruleLocks);
    }

    private void givenTaskSchedulerAccepts() {
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    private Rule rule(long id, LocalDateTime nextRunAt) {
        return Rule.builder()
                .id(id)
                .name("rule-" + id)
                .schedule(RefreshSchedule.DAILY)
                .nextRunAt(nextRunAt)
                .build();
    }

    private MaterializationRun run(long ruleId, RunStatus status) {
        return MaterializationRun.builder()
                .ruleId(ruleId)
                .status(status)
                .build();
    }

    private static Instant instantOf(LocalDateTime time) {
        return time.atZone(ZoneId.systemDefault()).toInstant();
    }

    private Runnable capturedJob() {
        ArgumentCaptor<Runnable> job = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(job.capture(), any(Instant.class));
        return job.getValue();
    }

    @Nested
    @DisplayName("Job slots")
    class JobSlots {

        @Test
        @DisplayName("schedule registers the rule at its nextRunAt")
        void scheduleAtNextRun() {
            givenTaskSchedulerAccepts();
            LocalDateTime nextRunAt = LocalDateTime.now().plusHours(2);

            materializationScheduler.schedule(rule(1, nextRunAt));

            verify(taskScheduler).schedule(any(Runnable.class), eq(instantOf(nextRunAt)));
            assertThat(materializationScheduler.isScheduled(1L)).isTrue();
            assertThat(materializationScheduler.getScheduledJobIds()).containsExactly("rule_1");
        }

        @Test
        @DisplayName("registering again replaces and cancels the previous job")
        void rescheduleReplaces() {
            ScheduledFuture<?> second = mock(ScheduledFuture.class);
            doReturn(future, second).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

            materializationScheduler.schedule(rule(1, LocalDateTime.now()));
            materializationScheduler.schedule(rule(1, LocalDateTime.now().plusDays(1)));

            verify(future).cancel(false);
            assertThat(materializationScheduler.getScheduledJobIds()).containsExactly("rule_1");
        }

        @Test
        @DisplayName("remove cancels the job; removing twice is harmless")
        void removeCancels() {
            givenTaskSchedulerAccepts();
            materializationScheduler.schedule(rule(1, LocalDateTime.now()));

            materializationScheduler.remove(1L);
            materializationScheduler.remove(1L);

            verify(future, times(1)).cancel(false);
            assertThat(materializationScheduler.isScheduled(1L)).isFalse();
        }

        @Test
        @DisplayName("nothing is registered while the scheduler is disabled")
        void disabled() {
            materializationConfig.setSchedulerEnabled(false);

            materializationScheduler.schedule(rule(1, LocalDateTime.now()));
            materializationScheduler.registerActiveRules();

            verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
            verify(segmentCatalogService, never()).resetOverdueRuns(any());
        }

        @Test
        @DisplayName("startup registers active rules after resetting overdue runs")
        void registerActiveRules() {
            givenTaskSchedulerAccepts();
            when(segmentCatalogService.resetOverdueRuns(any()))
                    .thenReturn(List.of(rule(2, LocalDateTime.now()), rule(1, LocalDateTime.now())));

            materializationScheduler.registerActiveRules();

            assertThat(materializationScheduler.getScheduledJobIds()).containsExactlyInAnyOrder("rule_1", "rule_2");
        }
    }

    @Nested
    @DisplayName("Catalog events")
    class CatalogEvents {

        @Test
        @DisplayName("created active rule is scheduled, inactive update removes it")
        void createdAndDeactivated() {
            givenTaskSchedulerAccepts();
            Rule rule = rule(1, LocalDateTime.now());

            materializationScheduler.onRuleEvent(new RuleEvent(this, rule, RuleEventType.CREATED));
            assertThat(materializationScheduler.isScheduled(1L)).isTrue();

            rule.setActive(false);
            materializationScheduler.onRuleEvent(new RuleEvent(this, rule, RuleEventType.UPDATED));
            assertThat(materializationScheduler.isScheduled(1L)).isFalse();
        }

        @Test
        @DisplayName("deleted rule loses its job")
        void deleted() {
            givenTaskSchedulerAccepts();
            Rule rule = rule(1, LocalDateTime.now());
            materializationScheduler.schedule(rule);

            materializationScheduler.onRuleEvent(new RuleEvent(this, rule, RuleEventType.DELETED));

            assertThat(materializationScheduler.getScheduledJobIds()).isEmpty();
        }

        @Test
        @DisplayName("trigger event queues a manual run next to the regular slot")
        void triggered() {
            givenTaskSchedulerAccepts();
            when(materializationExecutor.execute(1L, RunTrigger.MANUAL)).thenReturn(run(1, RunStatus.SUCCEEDED));

            materializationScheduler.onRuleEvent(new RuleEvent(this, rule(1, null), RuleEventType.TRIGGERED));

            assertThat(materializationScheduler.getScheduledJobIds())
                    .singleElement()
                    .asString()
                    .startsWith("manual_run_1_");
            capturedJob().run();
            verify(materializationExecutor).execute(1L, RunTrigger.MANUAL);
            assertThat(materializationScheduler.getScheduledJobIds()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Scheduled runs")
    class ScheduledRuns {

        @Test
        @DisplayName("success moves the slot to the new nextRunAt")
        void successReschedules() {
            givenTaskSchedulerAccepts();
            LocalDateTime next = LocalDateTime.now().plusDays(1);
            when(materializationExecutor.execute(1L, RunTrigger.SCHEDULED)).thenReturn(run(1, RunStatus.SUCCEEDED));
            when(segmentCatalogService.markRunSucceeded(eq(1L), any())).thenReturn(Optional.of(rule(1, next)));

            materializationScheduler.schedule(rule(1, LocalDateTime.now()));
            capturedJob().run();

            ArgumentCaptor<Instant> runAt = ArgumentCaptor.forClass(Instant.class);
            verify(taskScheduler, times(2)).schedule(any(Runnable.class), runAt.capture());
            assertThat(runAt.getAllValues().get(1)).isEqualTo(instantOf(next));
        }

        @Test
        @DisplayName("failure retries no earlier than the retry delay and keeps nextRunAt")
        void failureRetriesLater() {
            givenTaskSchedulerAccepts();
            when(materializationExecutor.execute(1L, RunTrigger.SCHEDULED))
                    .thenReturn(run(1, RunStatus.EXECUTION_FAILED));
            when(segmentCatalogService.findRule(1L)).thenReturn(Optional.of(rule(1, LocalDateTime.now())));

            materializationScheduler.schedule(rule(1, LocalDateTime.now()));
            Instant before = Instant.now();
            capturedJob().run();

            ArgumentCaptor<Instant> runAt = ArgumentCaptor.forClass(Instant.class);
            verify(taskScheduler, times(2)).schedule(any(Runnable.class), runAt.capture());
            assertThat(runAt.getAllValues().get(1)).isAfterOrEqualTo(before.plus(Duration.ofMinutes(5)));
            verify(segmentCatalogService, never()).markRunSucceeded(any(), any());
        }

        @Test
        @DisplayName("later persisted nextRunAt wins over the retry delay")
        void failureKeepsLaterNextRun() {
            givenTaskSchedulerAccepts();
            LocalDateTime later = LocalDateTime.now().plusHours(3);
            when(materializationExecutor.execute(1L, RunTrigger.SCHEDULED))
                    .thenReturn(run(1, RunStatus.DEPENDENCY_LOAD_FAILED));
            when(segmentCatalogService.findRule(1L)).thenReturn(Optional.of(rule(1, later)));

            materializationScheduler.schedule(rule(1, LocalDateTime.now()));
            capturedJob().run();

            ArgumentCaptor<Instant> runAt = ArgumentCaptor.forClass(Instant.class);
            verify(taskScheduler, times(2)).schedule(any(Runnable.class), runAt.capture());
            assertThat(runAt.getAllValues().get(1)).isEqualTo(instantOf(later));
        }

        @Test
        @DisplayName("rule already running elsewhere is skipped and retried")
        void overlappingRunSkipped() throws Exception {
            givenTaskSchedulerAccepts();
            when(segmentCatalogService.findRule(1L)).thenReturn(Optional.of(rule(1, LocalDateTime.now())));
            materializationScheduler.schedule(rule(1, LocalDateTime.now()));
            Runnable job = capturedJob();

            CountDownLatch locked = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Thread holder = new Thread(() -> {
                ruleLocks.lockFor(1L).lock();
                try {
                    locked.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    ruleLocks.lockFor(1L).unlock();
                }
            });
            holder.start();
            assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

            job.run();
            release.countDown();
            holder.join(5000);

            verify(materializationExecutor, never()).execute(any(), any());
            verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
        }

        @Test
        @DisplayName("executor exception does not escape the job")
        void exceptionContained() {
            givenTaskSchedulerAccepts();
            when(materializationExecutor.execute(1L, RunTrigger.SCHEDULED)).thenThrow(new IllegalStateException("boom"));
            when(segmentCatalogService.findRule(1L)).thenReturn(Optional.of(rule(1, LocalDateTime.now())));

            materializationScheduler.schedule(rule(1, LocalDateTime.now()));
            capturedJob().run();

            verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
        }
    }

    @Test
    @DisplayName("refresh-all runs active rules sequentially, dependencies first")
    void refreshAllInDependencyOrder() {
        Rule composite = Rule.builder()
                .id(2L)
                .dependencies(List.of(1L))
                .operation(SetOperation.INTERSECTION)
                .build();
        when(segmentCatalogService.listActiveRules()).thenReturn(List.of(composite, rule(1, null)));
        when(materializationExecutor.execute(1L, RunTrigger.MANUAL)).thenReturn(run(1, RunStatus.SUCCEEDED));
        when(materializationExecutor.execute(2L, RunTrigger.MANUAL)).thenReturn(run(2, RunStatus.SUCCEEDED));

        List<MaterializationRun> runs = materializationScheduler.refreshAll();

        assertThat(runs).extracting(MaterializationRun::getRuleId).containsExactly(1L, 2L);
        InOrder order = inOrder(materializationExecutor);
        order.verify(materializationExecutor).execute(1L, RunTrigger.MANUAL);
        order.verify(materializationExecutor).execute(2L, RunTrigger.MANUAL);
    }
}
