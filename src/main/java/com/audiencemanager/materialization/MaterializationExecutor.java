package com.audiencemanager.materialization;

import com.audiencemanager.catalog.SegmentCatalogService;
import com.audiencemanager.condition.ConditionCompiler;
import com.audiencemanager.config.MaterializationConfig;
import com.audiencemanager.domain.enums.RunStatus;
import com.audiencemanager.domain.enums.RunTrigger;
import com.audiencemanager.domain.enums.SetOperation;
import com.audiencemanager.domain.model.CompiledQuery;
import com.audiencemanager.domain.model.MaterializationRun;
import com.audiencemanager.domain.model.Rule;
import com.audiencemanager.domain.model.Segment;
import com.audiencemanager.domain.model.SegmentDataset;
import com.audiencemanager.event.SegmentMaterializedEvent;
import com.audiencemanager.exception.BatchEngineException;
import com.audiencemanager.exception.DependencyLoadException;
import com.audiencemanager.exception.ExecutionFailureException;
import com.audiencemanager.exception.MaterializationException;
import com.audiencemanager.exception.MetadataUpdateException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Computes a rule's segment and writes it to the rule's output table.
 *
 * <p>A base segment runs its compiled query. A composite segment loads the output
 * tables of its dependencies, adds the rows matching its residual conditions as one
 * more operand when it has any, and combines them with the rule's set operation.
 * Dependencies that were never materialized, or are older than their own inputs, are
 * materialized first within the same run; each rule is materialized at most once per
 * run and a dependency cycle fails the run instead of recursing.
 *
 * <p>The catalog update after the table write is retried through the Resilience4j
 * retry instance {@code catalogUpdate}. A run never throws: its outcome is returned,
 * recorded in the run history and published as a {@link SegmentMaterializedEvent}.
 */
@Service
@EnableConfigurationProperties(MaterializationConfig.class)
public class MaterializationExecutor {

    private static final Logger log = LoggerFactory.getLogger(MaterializationExecutor.class);

    static final String CATALOG_UPDATE_RETRY = "catalogUpdate";

    private final SegmentCatalogService segmentCatalogService;
    private final ConditionCompiler conditionCompiler;
    private final BatchEngine batchEngine;
    private final MaterializationConfig materializationConfig;
    private final Retry catalogUpdateRetry;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final RuleLocks ruleLocks;

    public MaterializationExecutor(
            SegmentCatalogService segmentCatalogService,
            ConditionCompiler conditionCompiler,
            BatchEngine batchEngine,
            MaterializationConfig materializationConfig,
            RetryRegistry retryRegistry,
            ApplicationEventPublisher applicationEventPublisher,
            RuleLocks ruleLocks) {
        this.segmentCatalogService = segmentCatalogService;
        this.conditionCompiler = conditionCompiler;
        this.batchEngine = batchEngine;
        this.materializationConfig = materializationConfig;
        this.catalogUpdateRetry = retryRegistry.retry(CATALOG_UPDATE_RETRY);
        this.applicationEventPublisher = applicationEventPublisher;
        this.ruleLocks = ruleLocks;
    }

    public MaterializationRun execute(Long ruleId) {
        return execute(ruleId, RunTrigger.MANUAL);
    }

    /**
     * Materializes the rule's segment.
     *
     * @return the recorded run; check {@link MaterializationRun#isSuccess()}
     */
    public MaterializationRun execute(Long ruleId, RunTrigger trigger) {
        return execute(ruleId, trigger, new RunContext());
    }

    private MaterializationRun execute(Long ruleId, RunTrigger trigger, RunContext context) {
        LocalDateTime startedAt = LocalDateTime.now();
        MaterializationRun.MaterializationRunBuilder run =
                MaterializationRun.builder().ruleId(ruleId).trigger(trigger).startedAt(startedAt);

        context.inProgress.add(ruleId);
        try {
            Rule rule = segmentCatalogService
                    .findRule(ruleId)
                    .orElseThrow(() -> new ExecutionFailureException(ruleId, "Rule " + ruleId + " not found", null));
            Segment segment = segmentCatalogService
                    .findSegmentByRule(ruleId)
                    .orElseThrow(() -> new ExecutionFailureException(ruleId, "No segment for rule " + ruleId, null));

            Computed computed = rule.isComposite() ? computeComposite(rule, context) : computeBase(rule, segment);
            SegmentDataset result = computed.dataset().withoutNullUsers();

            try {
                batchEngine.writeTable(result, segment.getTableName());
            } catch (BatchEngineException e) {
                throw new ExecutionFailureException(ruleId, "Writing " + segment.getTableName() + " failed: "
                        + e.getMessage(), e);
            }

            LocalDateTime refreshedAt = LocalDateTime.now();
            LocalDateTime dataAsOf = computed.dataAsOf() != null ? computed.dataAsOf() : refreshedAt;
            updateCatalog(ruleId, result.size(), refreshedAt, dataAsOf);
            context.refreshed.put(ruleId, dataAsOf);

            log.info("Materialized rule {} into {} ({} rows, trigger {})",
                    ruleId, segment.getTableName(), result.size(), trigger);
            run.status(RunStatus.SUCCEEDED).rowCount((long) result.size());
        } catch (MaterializationException e) {
            log.error("Materialization of rule {} failed ({}): {}", ruleId, e.getErrorCode(), e.getMessage(), e);
            run.status(statusOf(e)).message(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Materialization of rule {} failed unexpectedly: {}", ruleId, e.getMessage(), e);
            run.status(RunStatus.EXECUTION_FAILED).message(e.getMessage());
        } finally {
            context.inProgress.remove(ruleId);
        }

        MaterializationRun finished = run.finishedAt(LocalDateTime.now()).build();
        MaterializationRun recorded = record(finished);
        applicationEventPublisher.publishEvent(new SegmentMaterializedEvent(
                this, recorded, Duration.between(finished.getStartedAt(), finished.getFinishedAt())));
        return recorded;
    }

    // ---- Base segments ----

    /** A base segment's data is as fresh as the refresh itself, so no timestamp is returned here. */
    private Computed computeBase(Rule rule, Segment segment) {
        String sql = segment.getCompiledQuery();
        if (sql == null || sql.isBlank()) {
            sql = conditionCompiler.compile(rule.getConditions()).getSql();
        }
        try {
            return new Computed(runQuery(rule.getId(), sql), null);
        } catch (ExecutionFailureException e) {
            ensureOutputTable(segment.getTableName());
            throw e;
        }
    }

    /**
     * Leaves a zero-row table behind when a query fails before the segment was ever written.
     * An existing table keeps its last successful contents, matching the catalog's row count.
     */
    private void ensureOutputTable(String tableName) {
        try {
            if (!batchEngine.tableExists(tableName)) {
                batchEngine.writeTable(SegmentDataset.empty(), tableName);
                log.info("Created empty {} after a failed first run", tableName);
            }
        } catch (BatchEngineException e) {
            log.warn("Could not create empty {}: {}", tableName, e.getMessage());
        }
    }

    // ---- Composite segments ----

    private Computed computeComposite(Rule rule, RunContext context) {
        List<SegmentDataset> operands = new ArrayList<>();
        LocalDateTime dataAsOf = null;

        for (Long dependencyId : rule.getDependencies()) {
            LocalDateTime dependencyAsOf = ensureDependency(rule.getId(), dependencyId, context);
            operands.add(loadDependency(rule.getId(), dependencyId));
            dataAsOf = oldest(dataAsOf, dependencyAsOf);
        }

        if (rule.getConditions() != null && !rule.getConditions().isEmpty()) {
            CompiledQuery residual = conditionCompiler.compile(rule.getConditions());
            if (!residual.getWherePredicates().isEmpty() || !residual.getHavingPredicates().isEmpty()) {
                operands.add(runQuery(rule.getId(), residual.getSql()));
                dataAsOf = oldest(dataAsOf, LocalDateTime.now());
            }
        }

        return new Computed(combine(rule.getId(), rule.getOperation(), operands), dataAsOf);
    }

    /**
     * Makes sure a dependency's output table is usable and returns its data timestamp.
     * Missing or stale dependencies are materialized first when enabled.
     */
    private LocalDateTime ensureDependency(Long ruleId, Long dependencyId, RunContext context) {
        if (context.refreshed.containsKey(dependencyId)) {
            return context.refreshed.get(dependencyId);
        }
        if (context.inProgress.contains(dependencyId)) {
            throw new DependencyLoadException(
                    ruleId, dependencyId, "Dependency cycle through rule " + dependencyId, null);
        }

        Segment dependency = segmentCatalogService
                .findSegmentByRule(dependencyId)
                .orElseThrow(() -> new DependencyLoadException(
                        ruleId, dependencyId, "Dependency rule " + dependencyId + " has no segment", null));

        if (materializationConfig.isRefreshStaleDependencies() && needsRefresh(dependencyId, dependency)) {
            log.info("Rule {} needs dependency {} refreshed first", ruleId, dependencyId);
            MaterializationRun dependencyRun;
            ReentrantLock lock = ruleLocks.lockFor(dependencyId);
            // Waits for a run of the dependency already in progress on another thread.
            lock.lock();
            try {
                dependencyRun = execute(dependencyId, RunTrigger.DEPENDENCY, context);
            } finally {
                lock.unlock();
            }
            if (!dependencyRun.isSuccess()) {
                throw new DependencyLoadException(ruleId, dependencyId,
                        "Dependency rule " + dependencyId + " failed: " + dependencyRun.getMessage(), null);
            }
            return context.refreshed.get(dependencyId);
        }

        LocalDateTime asOf = dataAsOf(dependency);
        context.refreshed.put(dependencyId, asOf);
        return asOf;
    }

    private boolean needsRefresh(Long dependencyId, Segment dependency) {
        return needsRefresh(dependencyId, dependency, new HashSet<>());
    }

    /**
     * A composite segment is stale when an input's data is newer than its own, directly or
     * further upstream. Inputs are compared by {@code dataAsOf}, the same clock the segment
     * inherited its own {@code dataAsOf} from.
     */
    private boolean needsRefresh(Long dependencyId, Segment dependency, Set<Long> visited) {
        if (!visited.add(dependencyId)) {
            // cycle, reported by the run that reaches it
            return false;
        }
        if (!dependency.isMaterialized()) {
            return true;
        }
        try {
            if (!batchEngine.tableExists(dependency.getTableName())) {
                return true;
            }
        } catch (BatchEngineException e) {
            log.warn("Could not check table {}: {}", dependency.getTableName(), e.getMessage());
            return true;
        }
        if (!dependency.isComposite()) {
            return false;
        }
        LocalDateTime asOf = dataAsOf(dependency);
        for (Long upstreamId : dependency.getDependsOn()) {
            Optional<Segment> upstream = segmentCatalogService.findSegmentByRule(upstreamId);
            if (upstream.isEmpty()) {
                continue;
            }
            LocalDateTime upstreamAsOf = dataAsOf(upstream.get());
            if (upstreamAsOf != null && asOf != null && upstreamAsOf.isAfter(asOf)) {
                log.debug("Segment of rule {} is older than its input {}", dependencyId, upstreamId);
                return true;
            }
            if (needsRefresh(upstreamId, upstream.get(), visited)) {
                log.debug("Input {} of rule {} is itself stale", upstreamId, dependencyId);
                return true;
            }
        }
        return false;
    }

    private static LocalDateTime dataAsOf(Segment segment) {
        return segment.getDataAsOf() != null ? segment.getDataAsOf() : segment.getLastRefreshedAt();
    }

    private SegmentDataset loadDependency(Long ruleId, Long dependencyId) {
        Segment dependency = segmentCatalogService
                .findSegmentByRule(dependencyId)
                .orElseThrow(() -> new DependencyLoadException(
                        ruleId, dependencyId, "Dependency rule " + dependencyId + " has no segment", null));
        try {
            return batchEngine.readTable(dependency.getTableName());
        } catch (BatchEngineException e) {
            throw new DependencyLoadException(ruleId, dependencyId,
                    "Loading " + dependency.getTableName() + " failed: " + e.getMessage(), e);
        }
    }

    private SegmentDataset combine(Long ruleId, SetOperation operation, List<SegmentDataset> operands) {
        if (operands.isEmpty()) {
            throw new ExecutionFailureException(ruleId, "Composite rule has no operands", null);
        }
        if (operands.size() == 1) {
            return batchEngine.union(operands.get(0));
        }
        if (operation == null) {
            throw new ExecutionFailureException(ruleId, "Composite rule has no set operation", null);
        }
        SegmentDataset result = operands.get(0);
        switch (operation) {
            case UNION -> result = batchEngine.union(operands.toArray(new SegmentDataset[0]));
            case INTERSECTION -> {
                for (int i = 1; i < operands.size(); i++) {
                    result = batchEngine.intersect(result, operands.get(i));
                }
            }
            case DIFFERENCE -> {
                for (int i = 1; i < operands.size(); i++) {
                    result = batchEngine.except(result, operands.get(i));
                }
            }
        }
        return result;
    }

    // ---- Shared steps ----

    private SegmentDataset runQuery(Long ruleId, String sql) {
        try {
            return batchEngine.readQuery(sql);
        } catch (BatchEngineException e) {
            throw new ExecutionFailureException(ruleId, e.getMessage(), e);
        }
    }

    private void updateCatalog(Long ruleId, long rowCount, LocalDateTime refreshedAt, LocalDateTime dataAsOf) {
        try {
            catalogUpdateRetry.executeSupplier(
                    () -> segmentCatalogService.recordRefresh(ruleId, rowCount, refreshedAt, dataAsOf));
        } catch (RuntimeException e) {
            throw new MetadataUpdateException(
                    ruleId, "Table written but catalog update failed: " + e.getMessage(), e);
        }
    }

    private MaterializationRun record(MaterializationRun run) {
        try {
            return segmentCatalogService.recordRun(run);
        } catch (RuntimeException e) {
            log.error("Could not store run history for rule {}: {}", run.getRuleId(), e.getMessage(), e);
            return run;
        }
    }

    private static RunStatus statusOf(MaterializationException e) {
        return switch (e.getErrorCode()) {
            case DEPENDENCY_LOAD_FAILED -> RunStatus.DEPENDENCY_LOAD_FAILED;
            case METADATA_UPDATE_FAILED -> RunStatus.METADATA_UPDATE_FAILED;
            default -> RunStatus.EXECUTION_FAILED;
        };
    }

    private static LocalDateTime oldest(LocalDateTime current, LocalDateTime candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate == null) {
            return current;
        }
        return candidate.isBefore(current) ? candidate : current;
    }

    private record Computed(SegmentDataset dataset, LocalDateTime dataAsOf) {}

    /** Per-run memo of materialized rules and the rules currently on the stack. */
    private static final class RunContext {
        private final Map<Long, LocalDateTime> refreshed = new HashMap<>();
        private final Set<Long> inProgress = new HashSet<>();
    }
}
