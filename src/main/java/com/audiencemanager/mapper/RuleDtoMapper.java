package com.audiencemanager.mapper;

import com.audiencemanager.api.dto.request.RuleRequest;
import com.audiencemanager.api.dto.request.RuleUpdateRequest;
import com.audiencemanager.api.dto.response.MaterializationRunResponse;
import com.audiencemanager.api.dto.response.RuleResponse;
import com.audiencemanager.api.dto.response.SampleDataResponse;
import com.audiencemanager.api.dto.response.SegmentResponse;
import com.audiencemanager.domain.model.MaterializationRun;
import com.audiencemanager.domain.model.Rule;
import com.audiencemanager.domain.model.RuleDefinition;
import com.audiencemanager.domain.model.RuleUpdate;
import com.audiencemanager.domain.model.Segment;
import com.audiencemanager.domain.model.SegmentDataset;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for the rule and segment REST DTOs.
 *
 * <p>Conditions arrive untyped and are normalized by the controller before the
 * request reaches the catalog, so they are ignored here on the way in.
 */
@Mapper
public interface RuleDtoMapper {

    // Rule: Request -> Domain
    @Mapping(target = "conditions", ignore = true)
    RuleDefinition toDefinition(RuleRequest request);

    @Mapping(target = "conditions", ignore = true)
    RuleUpdate toUpdate(RuleUpdateRequest request);

    // Rule: Domain -> Response
    RuleResponse toResponse(Rule rule);

    List<RuleResponse> toResponseList(List<Rule> rules);

    // Segment: Domain -> Response
    SegmentResponse toResponse(Segment segment);

    List<SegmentResponse> toSegmentResponseList(List<Segment> segments);

    // MaterializationRun: Domain -> Response
    MaterializationRunResponse toResponse(MaterializationRun run);

    List<MaterializationRunResponse> toRunResponseList(List<MaterializationRun> runs);

    default SampleDataResponse toSampleResponse(Segment segment, SegmentDataset dataset) {
        return SampleDataResponse.builder()
                .segmentId(segment.getId())
                .tableName(segment.getTableName())
                .columns(SegmentDataset.COLUMNS)
                .rows(dataset.rows())
                .rowCount(dataset.size())
                .build();
    }
}
