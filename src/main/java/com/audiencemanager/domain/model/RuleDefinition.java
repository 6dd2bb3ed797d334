package com.audiencemanager.domain.model;

import com.audiencemanager.domain.enums.RefreshSchedule;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Input of {@code SegmentCatalogService.createRule}. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleDefinition {

    private String name;
    private String description;
    private List<Condition> conditions;
    private RefreshSchedule schedule;
    private Boolean active;
}
