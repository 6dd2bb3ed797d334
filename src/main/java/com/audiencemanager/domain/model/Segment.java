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
 * Catalog entry of a rule's materialized output (1:1 with {@link Rule}).
 *
 * <p>Exactly one of {@code compiledQuery} (base segment) or {@code dependsOn} +
 * {@code operation} (composite segment) is set. {@code dataAsOf} is the freshness of
 * the underlying data: the refresh time for a base segment, the oldest operand's
 * {@code dataAsOf} for a composite one.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Segment {

    private Long id;
    private Long ruleId;
    private String segmentName;
    private String tableName;
    private String description;

    private String compiledQuery;
    private List<Long> dependsOn;
    private SetOperation operation;

    private RefreshSchedule refreshFrequency;

    @Builder.Default
    private Long rowCount = 0L;

    private LocalDateTime lastRefreshedAt;
    private LocalDateTime dataAsOf;
    private LocalDateTime createdAt;
    private Long version;

    public boolean isComposite() {
        return dependsOn != null && !dependsOn.isEmpty();
    }

    public boolean isMaterialized() {
        return lastRefreshedAt != null;
    }
}
