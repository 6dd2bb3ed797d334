package com.audiencemanager.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Output of the condition compiler: a read-only aggregation query over the unified
 * transaction view, the rendered predicates it is made of, and the warnings for every
 * condition that was dropped.
 */
@Getter
@Builder
public class CompiledQuery {

    private final String sql;
    private final List<String> wherePredicates;
    private final List<String> havingPredicates;
    private final List<CompileWarning> warnings;

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
