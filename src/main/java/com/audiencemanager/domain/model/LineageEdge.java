package com.audiencemanager.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Edge {@code parent -> child}: the child segment is computed from the parent segment. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LineageEdge {

    private Long parentRuleId;
    private Long childRuleId;
}
