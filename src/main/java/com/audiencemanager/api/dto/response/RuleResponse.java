package com.audiencemanager.api.dto.response;

import com.audiencemanager.domain.enums.RefreshSchedule;
import com.audiencemanager.domain.enums.SetOperation;
import com.audiencemanager.domain.model.Condition;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API response DTO for a rule.
 * {@code conditions} are the residual predicates of a composite rule, {@code declaredConditions}
 * what the client declared.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleResponse {

    private Long id;
    private String name;
    private String description;
    private List<Condition> conditions;
    private List<Condition> declaredConditions;
    private List<Long> dependencies;
    private SetOperation operation;
    private boolean composite;
    private boolean active;
    private RefreshSchedule schedule;
    private LocalDateTime nextRunAt;
    private LocalDateTime lastRunAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
