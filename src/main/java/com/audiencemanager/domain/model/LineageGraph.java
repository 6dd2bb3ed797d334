package com.audiencemanager.domain.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Flat node/edge view of the upstream lineage of one segment, from the requested
 * segment back to the base segments it is ultimately computed from. Layout agnostic.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LineageGraph {

    private Long rootRuleId;
    private List<LineageNode> nodes;
    private List<LineageEdge> edges;
}
