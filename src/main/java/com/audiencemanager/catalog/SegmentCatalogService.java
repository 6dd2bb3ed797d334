package com.audiencemanager.catalog;

import com.audiencemanager.condition.ConditionCompiler;
import com.audiencemanager.condition.DependencyResolver;
import com.audiencemanager.config.MaterializationConfig;
import com.audiencemanager.config.WarehouseConfig;
import com.audiencemanager.domain.enums.RefreshSchedule;
import com.audiencemanager.domain.model.CompiledQuery;
import com.audiencemanager.domain.model.Condition;
import com.audiencemanager.domain.model.DependencyResolution;
import com.audiencemanager.domain.model.LineageGraph;
import com.audiencemanager.domain.model.MaterializationRun;
import com.audiencemanager.domain.model.Rule;
import com.audiencemanager.domain.model.RuleDefinition;
import com.audiencemanager.domain.model.RuleUpdate;
import com.audiencemanager.domain.model.Segment;
import com.audiencemanager.domain.model.SegmentDataset;
import com.audiencemanager.entity.RuleEntity;
import com.audiencemanager.entity.SegmentEntity;
import com.audiencemanager.event.RuleEvent;
import com.audiencemanager.event.RuleEventType;
import com.audiencemanager.exception.BusinessException;
import com.audiencemanager.exception.ErrorCode;
import com.audiencemanager.exception.ResourceNotFoundException;
import com.audiencemanager.mapper.JsonHelper;
import com.audiencemanager.mapper.MaterializationRunMapper;
import com.audiencemanager.mapper.RuleMapper;
import com.audiencemanager.mapper.SegmentMapper;
import com.audiencemanager.materialization.BatchEngine;
import com.audiencemanager.repository.jpa.MaterializationRunJpaRepository;
import com.audiencemanager.repository.jpa.RuleJpaRepository;
import com.audiencemanager.repository.jpa.SegmentJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Source of truth for rules and their segments.
 *
 * <p>Every rule owns exactly one segment, created and deleted together with it. On
 * create and on every condition change the rule is compiled and resolved against the
 * active rules: when existing segments cover part of its conditions it becomes a
 * composite rule (dependencies + operation + residual conditions), otherwise a base
 * rule with its own compiled query. The segment row mirrors that shape.
 *
 * <p>All mutations run in one transaction and roll back completely on any failure.
 * Job registration happens in the scheduler once the transaction has committed, driven
 * by the {@link RuleEvent}s published here.
 */
@Service
@EnableConfigurationProperties({WarehouseConfig.class, MaterializationConfig.class})
public class SegmentCatalogService {

    private static final Logger log = LoggerFactory.getLogger(SegmentCatalogService.class);

    private final RuleJpaRepository ruleJpaRepository;
    private final SegmentJpaRepository segmentJpaRepository;
    private final MaterializationRunJpaRepository materializationRunJpaRepository;
    private final ConditionCompiler conditionCompiler;
    private final DependencyResolver dependencyResolver;
    private final SegmentLineageService segmentLineageService;
    private final BatchEngine batchEngine;
    private final WarehouseConfig warehouseConfig;
    private final MaterializationConfig materializationConfig;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final RuleMapper ruleMapper = Mappers.getMapper(RuleMapper.class);
    private final SegmentMapper segmentMapper = Mappers.getMapper(SegmentMapper.class);
    private final MaterializationRunMapper materializationRunMapper = Mappers.getMapper(MaterializationRunMapper.class);

    public SegmentCatalogService(
            RuleJpaRepository ruleJpaRepository,
            SegmentJpaRepository segmentJpaRepository,
            MaterializationRunJpaRepository materializationRunJpaRepository,
            ConditionCompiler conditionCompiler,
            DependencyResolver dependencyResolver,
            SegmentLineageService segmentLineageService,
            BatchEngine batchEngine,
            WarehouseConfig warehouseConfig,
            MaterializationConfig materializationConfig,
            ApplicationEventPublisher applicationEventPublisher) {
        this.ruleJpaRepository = ruleJpaRepository;
        this.segmentJpaRepository = segmentJpaRepository;
        this.materializationRunJpaRepository = materializationRunJpaRepository;
        this.conditionCompiler = conditionCompiler;
        this.dependencyResolver = dependencyResolver;
        this.segmentLineageService = segmentLineageService;
        this.batchEngine = batchEngine;
        this.warehouseConfig = warehouseConfig;
        this.materializationConfig = materializationConfig;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // RULE LIFECYCLE
    // ========================

    /**
     * Creates a rule and its segment, reusing existing segments where possible.
     * The first run is due immediately.
     *
     * @throws BusinessException CONFLICT when the name is taken, VALIDATION_ERROR when
     *     the name is blank or none of the given conditions compiles
     */
    @Transactional
    public Rule createRule(RuleDefinition definition) {
        String name = requireName(definition.getName());
        if (ruleJpaRepository.existsByName(name)) {
            throw new BusinessException(ErrorCode.CONFLICT, "A rule named '" + name + "' already exists");
        }

        List<Condition> declared = copyOf(definition.getConditions());
        CompiledQuery compiled = compileChecked(declared);
        Optional<DependencyResolution> resolution = dependencyResolver.resolve(declared, loadActiveRules(), null);

        LocalDateTime now = LocalDateTime.now();
        RefreshSchedule schedule = definition.getSchedule() != null ? definition.getSchedule() : RefreshSchedule.ONCE;
        Rule rule = Rule.builder()
                .name(name)
                .description(definition.getDescription())
                .declaredConditions(declared)
                .active(definition.getActive() == null || definition.getActive())
                .schedule(schedule)
                .nextRunAt(now)
                .createdAt(now)
                .updatedAt(now)
                .build();
        applyShape(rule, declared, resolution);

        Rule saved = ruleMapper.toDomain(ruleJpaRepository.save(ruleMapper.toEntity(rule)));

        SegmentEntity segment = SegmentEntity.builder()
                .ruleId(saved.getId())
                .segmentName("segment_" + saved.getId())
                .tableName(warehouseConfig.outputTableName(saved.getId()))
                .description(definition.getDescription())
                .refreshFrequency(schedule)
                .rowCount(0L)
                .createdAt(now)
                .build();
        applyShape(segment, saved, compiled);
        segmentJpaRepository.save(segment);

        log.info(
                "Created rule {} '{}' as {} rule{}",
                saved.getId(),
                name,
                saved.isComposite() ? "composite" : "base",
                saved.isComposite() ? " over " + saved.getDependencies() : "");
        applicationEventPublisher.publishEvent(new RuleEvent(this, saved, RuleEventType.CREATED));
        return saved;
    }

    /**
     * Applies a partial update. A condition change recompiles the rule and resolves it
     * again, never against itself or any rule built on top of it.
     */
    @Transactional
    public Rule updateRule(Long ruleId, RuleUpdate update) {
        RuleEntity entity = findRuleEntity(ruleId);
        Rule rule = ruleMapper.toDomain(entity);
        SegmentEntity segment = segmentJpaRepository.findByRuleId(ruleId).orElseGet(() -> newSegment(rule));

        if (update.getName() != null) {
            String name = requireName(update.getName());
            if (!name.equals(rule.getName()) && ruleJpaRepository.existsByName(name)) {
                throw new BusinessException(ErrorCode.CONFLICT, "A rule named '" + name + "' already exists");
            }
            rule.setName(name);
        }
        if (update.getDescription() != null) {
            rule.setDescription(update.getDescription());
            segment.setDescription(update.getDescription());
        }

        boolean conditionsChanged = false;
        if (update.getConditions() != null) {
            List<Condition> declared = copyOf(update.getConditions());
            CompiledQuery compiled = compileChecked(declared);
            Set<Long> excluded = new HashSet<>(segmentLineageService.findDownstream(ruleId));
            excluded.add(ruleId);
            rule.setDeclaredConditions(declared);
            applyShape(rule, declared, dependencyResolver.resolveExcluding(declared, loadActiveRules(), excluded));
            applyShape(segment, rule, compiled);
            conditionsChanged = true;
        }
        if (update.getSchedule() != null) {
            rule.setSchedule(update.getSchedule());
            segment.setRefreshFrequency(update.getSchedule());
        }
        if (update.getActive() != null) {
            boolean reactivated = update.getActive() && !rule.isActive();
            rule.setActive(update.getActive());
            if (reactivated && (rule.getNextRunAt() == null || rule.getNextRunAt().isBefore(LocalDateTime.now()))) {
                rule.setNextRunAt(LocalDateTime.now());
            }
        }
        rule.setUpdatedAt(LocalDateTime.now());

        Rule saved = ruleMapper.toDomain(ruleJpaRepository.save(ruleMapper.toEntity(rule)));
        segmentJpaRepository.save(segment);

        if (conditionsChanged) {
            revalidateDependents(saved);
        }

        log.info("Updated rule {} (conditions changed: {})", ruleId, conditionsChanged);
        applicationEventPublisher.publishEvent(new RuleEvent(this, saved, RuleEventType.UPDATED));
        return saved;
    }

    /**
     * Deletes the rule, its segment and its run history. Rules that depended on it directly
     * are demoted to base rules compiled from their declared conditions. The output table
     * is dropped by {@code OutputTableCleaner} after the transaction commits.
     */
    @Transactional
    public void deleteRule(Long ruleId) {
        Rule rule = ruleMapper.toDomain(findRuleEntity(ruleId));

        for (Rule dependent : segmentLineageService.findDirectDependents(ruleId)) {
            demote(dependent);
        }

        Optional<SegmentEntity> segment = segmentJpaRepository.findByRuleId(ruleId);
        String tableName = segment.map(SegmentEntity::getTableName).orElse(warehouseConfig.outputTableName(ruleId));
        segment.ifPresent(segmentJpaRepository::delete);
        materializationRunJpaRepository.deleteByRuleId(ruleId);
        ruleJpaRepository.deleteById(ruleId);

        log.info("Deleted rule {} '{}', table {} is dropped on commit", ruleId, rule.getName(), tableName);
        applicationEventPublisher.publishEvent(new RuleEvent(this, rule, RuleEventType.DELETED, tableName));
    }

    /**
     * Requests an immediate one-off run of the rule, in addition to its regular slot.
     *
     * @throws BusinessException SCHEDULER_UNAVAILABLE when scheduling is switched off
     */
    @Transactional(readOnly = true)
    public void triggerRule(Long ruleId) {
        Rule rule = ruleMapper.toDomain(findRuleEntity(ruleId));
        if (!materializationConfig.isSchedulerEnabled()) {
            throw new BusinessException(ErrorCode.SCHEDULER_UNAVAILABLE, "Scheduler is not running");
        }
        log.info("Manual run requested for rule {}", ruleId);
        applicationEventPublisher.publishEvent(new RuleEvent(this, rule, RuleEventType.TRIGGERED));
    }

    // ========================
    // READS
    // ========================

    @Transactional(readOnly = true)
    public List<Rule> listRules() {
        return ruleMapper.toDomainList(ruleJpaRepository.findAll());
    }

    @Transactional(readOnly = true)
    public List<Rule> listActiveRules() {
        return loadActiveRules();
    }

    @Transactional(readOnly = true)
    public Rule getRule(Long ruleId) {
        return ruleMapper.toDomain(findRuleEntity(ruleId));
    }

    @Transactional(readOnly = true)
    public Optional<Rule> findRule(Long ruleId) {
        return ruleJpaRepository.findById(ruleId).map(ruleMapper::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Segment> listSegments() {
        return segmentMapper.toDomainList(segmentJpaRepository.findAll());
    }

    @Transactional(readOnly = true)
    public Segment getSegment(Long segmentId) {
        return segmentJpaRepository
                .findById(segmentId)
                .map(segmentMapper::toDomain)
                .orElseThrow(() -> ResourceNotFoundException.segment(segmentId));
    }

    @Transactional(readOnly = true)
    public Segment getSegmentByRule(Long ruleId) {
        return findSegmentByRule(ruleId)
                .orElseThrow(() -> ResourceNotFoundException.segmentOfRule(ruleId));
    }

    @Transactional(readOnly = true)
    public Optional<Segment> findSegmentByRule(Long ruleId) {
        return segmentJpaRepository.findByRuleId(ruleId).map(segmentMapper::toDomain);
    }

    /** First rows of the segment's output table; empty when it was never materialized. */
    @Transactional(readOnly = true)
    public SegmentDataset sampleRows(Long segmentId) {
        Segment segment = getSegment(segmentId);
        if (!batchEngine.tableExists(segment.getTableName())) {
            return SegmentDataset.empty();
        }
        return batchEngine.sampleRows(segment.getTableName(), warehouseConfig.getSampleRowLimit());
    }

    @Transactional(readOnly = true)
    public List<MaterializationRun> getRuns(Long ruleId) {
        findRuleEntity(ruleId);
        return materializationRunMapper.toDomainList(
                materializationRunJpaRepository.findByRuleIdOrderByStartedAtDesc(ruleId));
    }

    public LineageGraph getLineage(Long ruleId) {
        return segmentLineageService.getLineage(ruleId);
    }

    public Set<Long> findDownstream(Long ruleId) {
        return segmentLineageService.findDownstream(ruleId);
    }

    // ========================
    // MATERIALIZATION BOOKKEEPING
    // ========================

    /** Stores the outcome of a successful table write on the rule's segment. */
    @Transactional
    public Segment recordRefresh(Long ruleId, long rowCount, LocalDateTime refreshedAt, LocalDateTime dataAsOf) {
        SegmentEntity segment = segmentJpaRepository
                .findByRuleId(ruleId)
                .orElseThrow(() -> ResourceNotFoundException.segmentOfRule(ruleId));
        segment.setRowCount(rowCount);
        segment.setLastRefreshedAt(refreshedAt);
        segment.setDataAsOf(dataAsOf);
        return segmentMapper.toDomain(segmentJpaRepository.save(segment));
    }

    /**
     * Moves the rule's schedule forward after a successful run.
     *
     * @return the updated rule, or empty when it was deleted meanwhile
     */
    @Transactional
    public Optional<Rule> markRunSucceeded(Long ruleId, LocalDateTime ranAt) {
        return ruleJpaRepository.findById(ruleId).map(entity -> {
            entity.setLastRunAt(ranAt);
            entity.setNextRunAt(entity.getSchedule().nextRunFrom(ranAt));
            return ruleMapper.toDomain(ruleJpaRepository.save(entity));
        });
    }

    /** Pulls every overdue or unscheduled active rule forward to {@code now}. */
    @Transactional
    public List<Rule> resetOverdueRuns(LocalDateTime now) {
        List<Rule> rules = new ArrayList<>();
        for (RuleEntity entity : ruleJpaRepository.findByActiveTrue()) {
            if (entity.getNextRunAt() == null || entity.getNextRunAt().isBefore(now)) {
                entity.setNextRunAt(now);
                entity = ruleJpaRepository.save(entity);
            }
            rules.add(ruleMapper.toDomain(entity));
        }
        return rules;
    }

    @Transactional
    public MaterializationRun recordRun(MaterializationRun run) {
        return materializationRunMapper.toDomain(
                materializationRunJpaRepository.save(materializationRunMapper.toEntity(run)));
    }

    // ========================
    // INTERNALS
    // ========================

    /**
     * Re-resolves direct dependents of a rule whose conditions changed. A dependent that
     * is still covered gets the same dependency back with a recomputed residual; one that
     * is no longer covered falls back to other rules or becomes a base rule.
     */
    private void revalidateDependents(Rule changed) {
        for (Rule dependent : segmentLineageService.findDirectDependents(changed.getId())) {
            List<Condition> declared = copyOf(dependent.effectiveDeclaredConditions());
            Set<Long> excluded = new HashSet<>(segmentLineageService.findDownstream(dependent.getId()));
            excluded.add(dependent.getId());
            applyShape(dependent, declared, dependencyResolver.resolveExcluding(declared, loadActiveRules(), excluded));
            saveReshaped(dependent, conditionCompiler.compile(declared));
            log.info("Re-resolved rule {} after rule {} changed: dependencies {}",
                    dependent.getId(), changed.getId(), dependent.getDependencies());
        }
    }

    private void demote(Rule dependent) {
        List<Condition> declared = copyOf(dependent.effectiveDeclaredConditions());
        applyShape(dependent, declared, Optional.empty());
        saveReshaped(dependent, conditionCompiler.compile(declared));
        log.info("Demoted rule {} to a base rule", dependent.getId());
    }

    private void saveReshaped(Rule rule, CompiledQuery compiled) {
        rule.setUpdatedAt(LocalDateTime.now());
        Rule saved = ruleMapper.toDomain(ruleJpaRepository.save(ruleMapper.toEntity(rule)));
        SegmentEntity segment = segmentJpaRepository.findByRuleId(rule.getId()).orElseGet(() -> newSegment(saved));
        applyShape(segment, saved, compiled);
        segmentJpaRepository.save(segment);
        applicationEventPublisher.publishEvent(new RuleEvent(this, saved, RuleEventType.UPDATED));
    }

    private static void applyShape(Rule rule, List<Condition> declared, Optional<DependencyResolution> resolution) {
        rule.setDeclaredConditions(declared);
        if (resolution.isPresent()) {
            rule.setConditions(resolution.get().getResidual());
            rule.setDependencies(resolution.get().getDependencies());
            rule.setOperation(resolution.get().getOperation());
        } else {
            rule.setConditions(declared);
            rule.setDependencies(null);
            rule.setOperation(null);
        }
    }

    private static void applyShape(SegmentEntity segment, Rule rule, CompiledQuery compiled) {
        if (rule.isComposite()) {
            segment.setCompiledQuery(null);
            segment.setDependsOn(JsonHelper.writeRuleIds(rule.getDependencies()));
            segment.setOperation(rule.getOperation());
        } else {
            segment.setCompiledQuery(compiled.getSql());
            segment.setDependsOn(null);
            segment.setOperation(null);
        }
    }

    private SegmentEntity newSegment(Rule rule) {
        return SegmentEntity.builder()
                .ruleId(rule.getId())
                .segmentName("segment_" + rule.getId())
                .tableName(warehouseConfig.outputTableName(rule.getId()))
                .description(rule.getDescription())
                .refreshFrequency(rule.getSchedule())
                .rowCount(0L)
                .createdAt(LocalDateTime.now())
                .build();
    }

    private CompiledQuery compileChecked(List<Condition> declared) {
        CompiledQuery compiled = conditionCompiler.compile(declared);
        boolean nothingCompiled =
                compiled.getWherePredicates().isEmpty() && compiled.getHavingPredicates().isEmpty();
        if (!declared.isEmpty() && nothingCompiled) {
            List<String> reasons = compiled.getWarnings().stream()
                    .map(w -> "#" + w.getIndex() + " " + w.getReason() + ": " + w.getMessage())
                    .toList();
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "None of the conditions is valid", Map.of("warnings", reasons));
        }
        return compiled;
    }

    private List<Rule> loadActiveRules() {
        return ruleMapper.toDomainList(ruleJpaRepository.findByActiveTrue());
    }

    private RuleEntity findRuleEntity(Long ruleId) {
        return ruleJpaRepository
                .findById(ruleId)
                .orElseThrow(() -> ResourceNotFoundException.rule(ruleId));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Rule name is required");
        }
        return name.trim();
    }

    private static List<Condition> copyOf(List<Condition> conditions) {
        return conditions == null ? new ArrayList<>() : new ArrayList<>(conditions);
    }
}
