package com.audiencemanager.api.dto.response;

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
 * REST API response DTO for a segment catalog entry.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SegmentResponse {

    private Long id;
    private Long ruleId;
    private String segmentName;
    private String tableName;
    private String description;
    private String compiledQuery;
    private List<Long> dependsOn;
    private SetOperation operation;
    private boolean composite;
    private boolean materialized;
    private RefreshSchedule refreshFrequency;
    private Long rowCount;
    private LocalDateTime lastRefreshedAt;
    private LocalDateTime dataAsOf;
    private LocalDateTime createdAt;
}
