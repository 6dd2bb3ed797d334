package com.audiencemanager.condition;

import com.audiencemanager.domain.enums.SetOperation;
import com.audiencemanager.domain.model.Condition;
import com.audiencemanager.domain.model.ConditionSet;
import com.audiencemanager.domain.model.DependencyResolution;
import com.audiencemanager.domain.model.Rule;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Finds existing rules whose segments can be reused to compute a new rule.
 *
 * <p>Greedy subset cover: candidates are tried from the largest condition set down
 * (ties by ascending rule id) and a candidate is taken when all of its conditions are
 * still uncovered in the new rule. The accepted segments are intersected; whatever
 * conditions none of them covers is returned as the residual. The cover is not
 * guaranteed to be minimal.
 *
 * <p>A candidate whose conditions equal the whole new rule is never taken, so a rule
 * can not end up depending on an identical rule or on itself.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Resolves reusable dependencies for a condition list.
     *
     * @param newConditions conditions of the rule being created or updated
     * @param candidateRules existing rules; inactive ones are skipped
     * @param excludeRuleIds rules that must not be used, typically the rule itself and its descendants
     * @return the resolution, or empty when no candidate reduces the uncovered conditions
     */
    public Optional<DependencyResolution> resolveExcluding(
            List<Condition> newConditions, List<Rule> candidateRules, Collection<Long> excludeRuleIds) {
        ConditionSet target = ConditionSet.of(newConditions);
        if (target.isEmpty() || candidateRules == null || candidateRules.isEmpty()) {
            return Optional.empty();
        }

        List<Candidate> candidates = candidateRules.stream()
                .filter(Objects::nonNull)
                .filter(Rule::isActive)
                .filter(rule -> rule.getId() != null)
                .filter(rule -> excludeRuleIds == null || !excludeRuleIds.contains(rule.getId()))
                .map(rule -> new Candidate(rule.getId(), ConditionSet.of(rule.effectiveDeclaredConditions())))
                .filter(candidate -> !candidate.conditions().isEmpty())
                .sorted(Comparator.comparingInt((Candidate c) -> c.conditions().size())
                        .reversed()
                        .thenComparing(Candidate::ruleId))
                .toList();

        ConditionSet remaining = target;
        List<Long> dependencies = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (remaining.isEmpty()) {
                break;
            }
            if (candidate.conditions().equals(target)) {
                continue;
            }
            if (candidate.conditions().isSubsetOf(remaining)) {
                dependencies.add(candidate.ruleId());
                remaining = remaining.minus(candidate.conditions());
                log.debug("Rule {} covers {} conditions, {} left", candidate.ruleId(),
                        candidate.conditions().size(), remaining.size());
            }
        }

        if (dependencies.isEmpty() || remaining.size() >= target.size()) {
            return Optional.empty();
        }

        List<Condition> residual = residualConditions(newConditions, remaining);
        log.info("Resolved dependencies {} with {} residual conditions", dependencies, residual.size());

        return Optional.of(DependencyResolution.builder()
                .dependencies(List.copyOf(dependencies))
                .operation(SetOperation.INTERSECTION)
                .residual(residual)
                .build());
    }

    /** Resolves excluding a single rule id, or none when {@code excludeRuleId} is null. */
    public Optional<DependencyResolution> resolve(
            List<Condition> newConditions, List<Rule> candidateRules, Long excludeRuleId) {
        return resolveExcluding(newConditions, candidateRules, excludeRuleId == null ? List.of() : List.of(excludeRuleId));
    }

    /** Original condition objects still uncovered, in input order, duplicates collapsed. */
    private List<Condition> residualConditions(List<Condition> conditions, ConditionSet remaining) {
        List<Condition> residual = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Condition condition : conditions) {
            if (condition == null) {
                continue;
            }
            String tuple = ConditionSet.canonicalTuple(condition);
            if (remaining.contains(tuple) && seen.add(tuple)) {
                residual.add(condition);
            }
        }
        return List.copyOf(residual);
    }

    private record Candidate(Long ruleId, ConditionSet conditions) {}
}
