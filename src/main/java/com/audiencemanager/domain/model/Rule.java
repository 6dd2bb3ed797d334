package com.audiencemanager.domain.model;

import com.audiencemanager.domain.enums.RefreshSchedule;
import com.audiencemanager.domain.enums.SetOperation;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Domain model for a segmentation rule.
 *
 * <p>A rule is either a <b>base</b> rule, whose segment is compiled straight from raw
 * transactions, or a <b>composite</b> rule, whose segment combines the segments of
 * {@code dependencies} with {@code operation}. The two fields are set together or not
 * at all. For a composite rule {@code conditions} holds only the residual predicates
 * its dependencies do not cover, while {@code declaredConditions} always holds the
 * full list the user declared.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Rule {

    private Long id;
    private String name;
    private String description;

    private List<Condition> conditions;
    private List<Condition> declaredConditions;

    private List<Long> dependencies;
    private SetOperation operation;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private RefreshSchedule schedule = RefreshSchedule.DAILY;

    private LocalDateTime nextRunAt;
    private LocalDateTime lastRunAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private Long version;

    public boolean isComposite() {
        return dependencies != null && !dependencies.isEmpty() && operation != null;
    }

    /** Conditions the rule was declared with, falling back to the stored ones for old rows. */
    public List<Condition> effectiveDeclaredConditions() {
        return declaredConditions != null ? declaredConditions : conditions;
    }
}
