package com.audiencemanager.domain.model;

import com.audiencemanager.domain.enums.SetOperation;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a successful subset-cover resolution: the prior rules to reuse, how to
 * combine them, and the conditions none of them covers.
 */
@Getter
@Builder
@ToString
public class DependencyResolution {

    private final List<Long> dependencies;
    private final SetOperation operation;
    private final List<Condition> residual;
}
