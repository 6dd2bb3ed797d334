package com.audiencemanager.testsupport;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

import com.audiencemanager.entity.MaterializationRunEntity;
import com.audiencemanager.entity.RuleEntity;
import com.audiencemanager.entity.SegmentEntity;
import com.audiencemanager.repository.jpa.MaterializationRunJpaRepository;
import com.audiencemanager.repository.jpa.RuleJpaRepository;
import com.audiencemanager.repository.jpa.SegmentJpaRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import org.mockito.quality.Strictness;

/**
 * Map-backed stand-ins for the catalog JPA repositories, so catalog services can be
 * exercised end to end without a database. Ids are assigned on first save.
 */
public class InMemoryCatalogStore {

    private final Map<Long, RuleEntity> rules = new TreeMap<>();
    private final Map<Long, SegmentEntity> segments = new TreeMap<>();
    private final Map<Long, MaterializationRunEntity> runs = new TreeMap<>();

    private final AtomicLong ruleIds = new AtomicLong();
    private final AtomicLong segmentIds = new AtomicLong();
    private final AtomicLong runIds = new AtomicLong();

    private final RuleJpaRepository ruleJpaRepository =
            mock(RuleJpaRepository.class, withSettings().strictness(Strictness.LENIENT));
    private final SegmentJpaRepository segmentJpaRepository =
            mock(SegmentJpaRepository.class, withSettings().strictness(Strictness.LENIENT));
    private final MaterializationRunJpaRepository materializationRunJpaRepository =
            mock(MaterializationRunJpaRepository.class, withSettings().strictness(Strictness.LENIENT));

    public InMemoryCatalogStore() {
        stubRules();
        stubSegments();
        stubRuns();
    }

    public RuleJpaRepository rules() {
        return ruleJpaRepository;
    }

    public SegmentJpaRepository segments() {
        return segmentJpaRepository;
    }

    public MaterializationRunJpaRepository runs() {
        return materializationRunJpaRepository;
    }

    public RuleEntity rule(Long id) {
        return rules.get(id);
    }

    public Optional<SegmentEntity> segmentOf(Long ruleId) {
        return segments.values().stream()
                .filter(s -> Objects.equals(s.getRuleId(), ruleId))
                .findFirst();
    }

    public int runCount() {
        return runs.size();
    }

    private void stubRules() {
        when(ruleJpaRepository.save(any(RuleEntity.class))).thenAnswer(invocation -> {
            RuleEntity entity = invocation.getArgument(0);
            if (entity.getId() == null) {
                entity.setId(ruleIds.incrementAndGet());
            }
            rules.put(entity.getId(), entity);
            return entity;
        });
        when(ruleJpaRepository.findById(any())).thenAnswer(invocation ->
                Optional.ofNullable(rules.get(invocation.<Long>getArgument(0))));
        when(ruleJpaRepository.findAll()).thenAnswer(invocation -> new ArrayList<>(rules.values()));
        when(ruleJpaRepository.findByActiveTrue()).thenAnswer(invocation ->
                rules.values().stream().filter(RuleEntity::isActive).toList());
        when(ruleJpaRepository.existsByName(any())).thenAnswer(invocation ->
                rules.values().stream().anyMatch(r -> r.getName().equals(invocation.getArgument(0))));
        doAnswer(invocation -> rules.remove(invocation.<Long>getArgument(0)))
                .when(ruleJpaRepository)
                .deleteById(any());
    }

    private void stubSegments() {
        when(segmentJpaRepository.save(any(SegmentEntity.class))).thenAnswer(invocation -> {
            SegmentEntity entity = invocation.getArgument(0);
            if (entity.getId() == null) {
                entity.setId(segmentIds.incrementAndGet());
            }
            segments.put(entity.getId(), entity);
            return entity;
        });
        when(segmentJpaRepository.findById(any())).thenAnswer(invocation ->
                Optional.ofNullable(segments.get(invocation.<Long>getArgument(0))));
        when(segmentJpaRepository.findAll()).thenAnswer(invocation -> new ArrayList<>(segments.values()));
        when(segmentJpaRepository.findByRuleId(any())).thenAnswer(invocation ->
                segmentOf(invocation.getArgument(0)));
        doAnswer(invocation -> segments.remove(invocation.<SegmentEntity>getArgument(0).getId()))
                .when(segmentJpaRepository)
                .delete(any(SegmentEntity.class));
    }

    private void stubRuns() {
        when(materializationRunJpaRepository.save(any(MaterializationRunEntity.class))).thenAnswer(invocation -> {
            MaterializationRunEntity entity = invocation.getArgument(0);
            if (entity.getId() == null) {
                entity.setId(runIds.incrementAndGet());
            }
            runs.put(entity.getId(), entity);
            return entity;
        });
        when(materializationRunJpaRepository.findByRuleIdOrderByStartedAtDesc(any())).thenAnswer(invocation ->
                runs.values().stream()
                        .filter(r -> Objects.equals(r.getRuleId(), invocation.getArgument(0)))
                        .sorted(Comparator.comparing(MaterializationRunEntity::getStartedAt).reversed())
                        .toList());
        doAnswer(invocation -> runs.values().removeIf(r -> Objects.equals(r.getRuleId(), invocation.getArgument(0))))
                .when(materializationRunJpaRepository)
                .deleteByRuleId(any());
    }
}
