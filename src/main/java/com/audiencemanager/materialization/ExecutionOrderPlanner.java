package com.audiencemanager.materialization;

import com.audiencemanager.domain.model.Rule;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Orders rules so that every rule comes after the rules its segment depends on.
 *
 * <p>Kahn's algorithm over the lineage DAG restricted to the given rules; among rules
 * that are ready at the same time the lower id goes first. Dependencies outside the
 * given set are ignored. Rules caught in a cycle can not be ordered and are appended at
 * the end by id, with an error logged.
 */
@Component
public class ExecutionOrderPlanner {

    private static final Logger log = LoggerFactory.getLogger(ExecutionOrderPlanner.class);

    public List<Rule> order(List<Rule> rules) {
        Map<Long, Rule> byId = new TreeMap<>();
        for (Rule rule : rules) {
            byId.put(rule.getId(), rule);
        }

        Map<Long, Integer> inDegree = new HashMap<>();
        Map<Long, List<Long>> children = new HashMap<>();
        for (Rule rule : byId.values()) {
            inDegree.putIfAbsent(rule.getId(), 0);
            if (rule.getDependencies() == null) {
                continue;
            }
            for (Long parent : rule.getDependencies().stream().distinct().toList()) {
                if (byId.containsKey(parent) && !parent.equals(rule.getId())) {
                    children.computeIfAbsent(parent, k -> new ArrayList<>()).add(rule.getId());
                    inDegree.merge(rule.getId(), 1, Integer::sum);
                } else if (parent.equals(rule.getId())) {
                    inDegree.merge(rule.getId(), 1, Integer::sum);
                }
            }
        }

        PriorityQueue<Long> ready = new PriorityQueue<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<Rule> ordered = new ArrayList<>(byId.size());
        while (!ready.isEmpty()) {
            Long id = ready.poll();
            ordered.add(byId.get(id));
            for (Long child : children.getOrDefault(id, List.of())) {
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    ready.add(child);
                }
            }
        }

        if (ordered.size() < byId.size()) {
            List<Long> cyclic = byId.keySet().stream()
                    .filter(id -> inDegree.get(id) > 0)
                    .toList();
            log.error("Rules {} form a dependency cycle; running them last", cyclic);
            cyclic.forEach(id -> ordered.add(byId.get(id)));
        }
        return ordered;
    }
}
