package com.audiencemanager.api.controller;

import com.audiencemanager.api.dto.response.SampleDataResponse;
import com.audiencemanager.api.dto.response.SegmentResponse;
import com.audiencemanager.catalog.SegmentCatalogService;
import com.audiencemanager.domain.model.LineageGraph;
import com.audiencemanager.domain.model.Segment;
import com.audiencemanager.mapper.RuleDtoMapper;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only REST API over the segment catalog: entries, lineage and sample output rows.
 */
@RestController
@RequestMapping("/api/segments")
public class SegmentController {

    private final SegmentCatalogService segmentCatalogService;

    private final RuleDtoMapper ruleDtoMapper = Mappers.getMapper(RuleDtoMapper.class);

    public SegmentController(SegmentCatalogService segmentCatalogService) {
        this.segmentCatalogService = segmentCatalogService;
    }

    @GetMapping
    public List<SegmentResponse> getAllSegments() {
        return ruleDtoMapper.toSegmentResponseList(segmentCatalogService.listSegments());
    }

    @GetMapping("/{id}")
    public SegmentResponse getSegment(@PathVariable Long id) {
        return ruleDtoMapper.toResponse(segmentCatalogService.getSegment(id));
    }

    @GetMapping("/by-rule/{ruleId}")
    public SegmentResponse getSegmentByRule(@PathVariable Long ruleId) {
        return ruleDtoMapper.toResponse(segmentCatalogService.getSegmentByRule(ruleId));
    }

    @GetMapping("/{id}/lineage")
    public LineageGraph getLineage(@PathVariable Long id) {
        Segment segment = segmentCatalogService.getSegment(id);
        return segmentCatalogService.getLineage(segment.getRuleId());
    }

    @GetMapping("/{id}/sample-data")
    public SampleDataResponse getSampleData(@PathVariable Long id) {
        Segment segment = segmentCatalogService.getSegment(id);
        return ruleDtoMapper.toSampleResponse(segment, segmentCatalogService.sampleRows(id));
    }
}
