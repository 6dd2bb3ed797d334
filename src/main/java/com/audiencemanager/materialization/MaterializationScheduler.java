package com.audiencemanager.materialization;

import com.audiencemanager.catalog.SegmentCatalogService;
import com.audiencemanager.config.MaterializationConfig;
import com.audiencemanager.domain.enums.RunTrigger;
import com.audiencemanager.domain.model.MaterializationRun;
import com.audiencemanager.domain.model.Rule;
import com.audiencemanager.event.RuleEvent;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs every active rule on its refresh schedule.
 *
 * <p>Each rule owns one job slot, keyed {@code rule_<id>}; registering a rule again
 * replaces its pending job. A manual trigger adds a one-off job
 * {@code manual_run_<id>_<epochMillis>} next to the regular slot.
 *
 * <ul>
 *   <li>Success -- the catalog moves {@code nextRunAt} to now + the schedule's interval
 *       and the slot is re-registered at that time.</li>
 *   <li>Failure -- the persisted {@code nextRunAt} is left as is and the slot is
 *       re-registered at {@code max(nextRunAt, now + retryDelay)}.</li>
 * </ul>
 *
 * <p>A rule never runs concurrently with itself: a run that finds the rule's lock held
 * is skipped. Nothing a job does can escape it and kill the worker thread.
 */
@Service
@EnableConfigurationProperties(MaterializationConfig.class)
public class MaterializationScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaterializationScheduler.class);

    private final TaskScheduler taskScheduler;
    private final MaterializationExecutor materializationExecutor;
    private final SegmentCatalogService segmentCatalogService;
    private final ExecutionOrderPlanner executionOrderPlanner;
    private final MaterializationConfig materializationConfig;
    private final RuleLocks ruleLocks;

    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();

    public MaterializationScheduler(
            @Qualifier("materializationTaskScheduler") TaskScheduler taskScheduler,
            MaterializationExecutor materializationExecutor,
            SegmentCatalogService segmentCatalogService,
            ExecutionOrderPlanner executionOrderPlanner,
            MaterializationConfig materializationConfig,
            RuleLocks ruleLocks) {
        this.taskScheduler = taskScheduler;
        this.materializationExecutor = materializationExecutor;
        this.segmentCatalogService = segmentCatalogService;
        this.executionOrderPlanner = executionOrderPlanner;
        this.materializationConfig = materializationConfig;
        this.ruleLocks = ruleLocks;
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Registers all active rules once the application is up. Overdue or unscheduled
     * rules are due immediately; registration follows dependency order so that
     * simultaneously due rules start with their dependencies.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void registerActiveRules() {
        if (!materializationConfig.isSchedulerEnabled()) {
            log.info("Materialization scheduler disabled, no rules registered");
            return;
        }
        List<Rule> rules = executionOrderPlanner.order(segmentCatalogService.resetOverdueRuns(LocalDateTime.now()));
        rules.forEach(this::schedule);
        log.info("Registered {} active rules", rules.size());
    }

    /** Keeps job slots in line with catalog changes once they are committed. */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRuleEvent(RuleEvent event) {
        Rule rule = event.getRule();
        switch (event.getEventType()) {
            case CREATED, UPDATED -> {
                if (rule.isActive()) {
                    schedule(rule);
                } else {
                    remove(rule.getId());
                }
            }
            case DELETED -> {
                remove(rule.getId());
                ruleLocks.release(rule.getId());
            }
            case TRIGGERED -> triggerNow(rule.getId());
        }
    }

    // ========================
    // JOB SLOTS
    // ========================

    /** Registers (or replaces) the rule's job at its {@code nextRunAt}, or now if unset. */
    public void schedule(Rule rule) {
        if (!materializationConfig.isSchedulerEnabled()) {
            return;
        }
        LocalDateTime runAt = rule.getNextRunAt() != null ? rule.getNextRunAt() : LocalDateTime.now();
        scheduleAt(rule.getId(), runAt);
    }

    /** Removes the rule's regular job slot; a missing job is not an error. */
    public void remove(Long ruleId) {
        ScheduledFuture<?> future = jobs.remove(jobId(ruleId));
        if (future != null) {
            future.cancel(false);
            log.info("Removed job {}", jobId(ruleId));
        } else {
            log.debug("No job {} to remove", jobId(ruleId));
        }
    }

    /**
     * Queues a one-off run of the rule right away. The regular slot is untouched.
     *
     * @return the id of the one-off job
     */
    public String triggerNow(Long ruleId) {
        String manualJobId = "manual_run_" + ruleId + "_" + System.currentTimeMillis();
        ScheduledFuture<?> future = taskScheduler.schedule(
                () -> {
                    try {
                        runExclusively(ruleId, RunTrigger.MANUAL);
                    } finally {
                        jobs.remove(manualJobId);
                    }
                },
                Instant.now());
        jobs.put(manualJobId, future);
        if (future.isDone()) {
            jobs.remove(manualJobId);
        }
        log.info("Queued manual job {}", manualJobId);
        return manualJobId;
    }

    /**
     * Runs every active rule once, sequentially, dependencies first.
     *
     * @return the runs in execution order; rules skipped because they were already
     *     running have no entry
     */
    public List<MaterializationRun> refreshAll() {
        List<Rule> ordered = executionOrderPlanner.order(segmentCatalogService.listActiveRules());
        List<MaterializationRun> runs = new ArrayList<>();
        for (Rule rule : ordered) {
            runExclusively(rule.getId(), RunTrigger.MANUAL).ifPresent(runs::add);
        }
        log.info("Refreshed {} of {} active rules", runs.stream().filter(MaterializationRun::isSuccess).count(),
                ordered.size());
        return runs;
    }

    public Set<String> getScheduledJobIds() {
        return Set.copyOf(jobs.keySet());
    }

    public boolean isScheduled(Long ruleId) {
        return jobs.containsKey(jobId(ruleId));
    }

    // ========================
    // EXECUTION
    // ========================

    /** Body of the regular job slot. */
    void runScheduled(Long ruleId) {
        try {
            Optional<MaterializationRun> run = runExclusively(ruleId, RunTrigger.SCHEDULED);
            if (run.isEmpty()) {
                segmentCatalogService.findRule(ruleId).ifPresent(rule -> rescheduleAfterFailure(ruleId, rule));
                return;
            }
            if (run.get().isSuccess()) {
                segmentCatalogService
                        .markRunSucceeded(ruleId, LocalDateTime.now())
                        .filter(Rule::isActive)
                        .ifPresentOrElse(this::schedule, () -> remove(ruleId));
            } else {
                segmentCatalogService
                        .findRule(ruleId)
                        .filter(Rule::isActive)
                        .ifPresentOrElse(rule -> rescheduleAfterFailure(ruleId, rule), () -> remove(ruleId));
            }
        } catch (RuntimeException e) {
            log.error("Scheduled job for rule {} failed: {}", ruleId, e.getMessage(), e);
            scheduleAt(ruleId, LocalDateTime.now().plus(materializationConfig.getRetryDelay()));
        }
    }

    /**
     * Runs the rule unless it is already running.
     *
     * @return the run, or empty when the rule was busy
     */
    Optional<MaterializationRun> runExclusively(Long ruleId, RunTrigger trigger) {
        ReentrantLock lock = ruleLocks.lockFor(ruleId);
        if (!lock.tryLock()) {
            log.warn("Rule {} is already running, skipping {} run", ruleId, trigger);
            return Optional.empty();
        }
        try {
            return Optional.of(materializationExecutor.execute(ruleId, trigger));
        } catch (RuntimeException e) {
            log.error("Run of rule {} failed: {}", ruleId, e.getMessage(), e);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    private void rescheduleAfterFailure(Long ruleId, Rule rule) {
        LocalDateTime earliest = LocalDateTime.now().plus(materializationConfig.getRetryDelay());
        LocalDateTime persisted = rule.getNextRunAt();
        LocalDateTime retryAt = persisted != null && persisted.isAfter(earliest) ? persisted : earliest;
        log.warn("Rule {} will be retried at {}", ruleId, retryAt);
        scheduleAt(ruleId, retryAt);
    }

    private void scheduleAt(Long ruleId, LocalDateTime runAt) {
        String jobId = jobId(ruleId);
        ScheduledFuture<?> future = taskScheduler.schedule(
                () -> runScheduled(ruleId), runAt.atZone(ZoneId.systemDefault()).toInstant());
        ScheduledFuture<?> previous = jobs.put(jobId, future);
        if (previous != null && previous != future) {
            previous.cancel(false);
        }
        log.debug("Job {} scheduled at {} (in {})", jobId, runAt, Duration.between(LocalDateTime.now(), runAt));
    }

    static String jobId(Long ruleId) {
        return "rule_" + ruleId;
    }
}
