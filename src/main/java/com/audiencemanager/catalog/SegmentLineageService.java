package com.audiencemanager.catalog;

import com.audiencemanager.domain.model.LineageEdge;
import com.audiencemanager.domain.model.LineageGraph;
import com.audiencemanager.domain.model.LineageNode;
import com.audiencemanager.domain.model.Rule;
import com.audiencemanager.domain.model.Segment;
import com.audiencemanager.entity.RuleEntity;
import com.audiencemanager.exception.ResourceNotFoundException;
import com.audiencemanager.mapper.RuleMapper;
import com.audiencemanager.mapper.SegmentMapper;
import com.audiencemanager.repository.jpa.RuleJpaRepository;
import com.audiencemanager.repository.jpa.SegmentJpaRepository;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Navigates the segment lineage DAG.
 *
 * <p>An edge {@code parent -> child} exists when the child's segment depends on the
 * parent's segment. Upstream lineage walks from a segment back to its base segments;
 * downstream traversal finds every segment built on top of a rule. Both walks keep a
 * visited set, so a corrupted catalog with a cycle still terminates.
 */
@Service
public class SegmentLineageService {

    private static final Logger log = LoggerFactory.getLogger(SegmentLineageService.class);

    private final RuleJpaRepository ruleJpaRepository;
    private final SegmentJpaRepository segmentJpaRepository;

    private final RuleMapper ruleMapper = Mappers.getMapper(RuleMapper.class);
    private final SegmentMapper segmentMapper = Mappers.getMapper(SegmentMapper.class);

    public SegmentLineageService(RuleJpaRepository ruleJpaRepository, SegmentJpaRepository segmentJpaRepository) {
        this.ruleJpaRepository = ruleJpaRepository;
        this.segmentJpaRepository = segmentJpaRepository;
    }

    /**
     * Upstream lineage of a rule's segment: the rule itself, everything it is computed
     * from, and the edges between them. Nodes are listed in depth-first discovery order.
     */
    @Transactional(readOnly = true)
    public LineageGraph getLineage(Long ruleId) {
        Map<Long, Rule> rulesById = loadRules();
        if (!rulesById.containsKey(ruleId)) {
            throw ResourceNotFoundException.rule(ruleId);
        }

        List<LineageNode> nodes = new ArrayList<>();
        List<LineageEdge> edges = new ArrayList<>();
        Set<Long> visited = new LinkedHashSet<>();
        Deque<Long> stack = new ArrayDeque<>();
        stack.push(ruleId);

        while (!stack.isEmpty()) {
            Long current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            Rule rule = rulesById.get(current);
            Optional<Segment> segment =
                    segmentJpaRepository.findByRuleId(current).map(segmentMapper::toDomain);
            nodes.add(toNode(current, rule, segment.orElse(null)));

            List<Long> parents = parentsOf(rule, segment.orElse(null));
            for (Long parent : parents) {
                edges.add(new LineageEdge(parent, current));
            }
            // Reverse push keeps the declared dependency order in the DFS.
            for (int i = parents.size() - 1; i >= 0; i--) {
                Long parent = parents.get(i);
                if (visited.contains(parent)) {
                    continue;
                }
                if (!rulesById.containsKey(parent)) {
                    log.warn("Rule {} depends on missing rule {}", current, parent);
                }
                stack.push(parent);
            }
        }

        return LineageGraph.builder().rootRuleId(ruleId).nodes(nodes).edges(edges).build();
    }

    /**
     * Every rule whose segment is computed, directly or transitively, from {@code ruleId}.
     * The rule itself is not included.
     */
    @Transactional(readOnly = true)
    public Set<Long> findDownstream(Long ruleId) {
        Map<Long, List<Long>> children = new HashMap<>();
        for (Rule rule : loadRules().values()) {
            if (rule.getDependencies() == null) {
                continue;
            }
            for (Long parent : rule.getDependencies()) {
                children.computeIfAbsent(parent, k -> new ArrayList<>()).add(rule.getId());
            }
        }

        Set<Long> downstream = new LinkedHashSet<>();
        Deque<Long> queue = new ArrayDeque<>(children.getOrDefault(ruleId, List.of()));
        while (!queue.isEmpty()) {
            Long current = queue.poll();
            if (current.equals(ruleId) || !downstream.add(current)) {
                continue;
            }
            queue.addAll(children.getOrDefault(current, List.of()));
        }
        return downstream;
    }

    /** Rules that depend directly on {@code ruleId}. */
    @Transactional(readOnly = true)
    public List<Rule> findDirectDependents(Long ruleId) {
        return loadRules().values().stream()
                .filter(rule -> rule.getDependencies() != null && rule.getDependencies().contains(ruleId))
                .toList();
    }

    private Map<Long, Rule> loadRules() {
        Map<Long, Rule> rulesById = new HashMap<>();
        for (RuleEntity entity : ruleJpaRepository.findAll()) {
            rulesById.put(entity.getId(), ruleMapper.toDomain(entity));
        }
        return rulesById;
    }

    private static List<Long> parentsOf(Rule rule, Segment segment) {
        if (segment != null && segment.getDependsOn() != null) {
            return segment.getDependsOn();
        }
        if (rule != null && rule.getDependencies() != null) {
            return rule.getDependencies();
        }
        return List.of();
    }

    private static LineageNode toNode(Long ruleId, Rule rule, Segment segment) {
        LineageNode.LineageNodeBuilder node = LineageNode.builder()
                .ruleId(ruleId)
                .composite(rule != null && rule.isComposite());
        if (rule != null) {
            node.operation(rule.getOperation());
        }
        if (segment != null) {
            node.segmentId(segment.getId())
                    .segmentName(segment.getSegmentName())
                    .tableName(segment.getTableName())
                    .rowCount(segment.getRowCount())
                    .lastRefreshedAt(segment.getLastRefreshedAt());
        }
        return node.build();
    }
}
