package com.audiencemanager.domain.model;

import com.audiencemanager.domain.enums.RefreshSchedule;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Partial update of a rule; null fields are left unchanged. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleUpdate {

    private String name;
    private String description;
    private List<Condition> conditions;
    private RefreshSchedule schedule;
    private Boolean active;
}
