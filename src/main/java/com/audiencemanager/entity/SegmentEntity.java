package com.audiencemanager.entity;

import com.audiencemanager.domain.enums.RefreshSchedule;
import com.audiencemanager.domain.enums.SetOperation;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the segment_catalog table, one row per rule.
 *
 * <p>A base segment stores its {@code compiled_query}; a composite segment stores
 * {@code depends_on} (JSON list of rule ids) and {@code operation} instead. The two
 * shapes are never mixed.
 */
@Entity
@Table(name = "segment_catalog")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SegmentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "rule_id", nullable = false, unique = true)
    private Long ruleId;

    @Column(name = "segment_name", nullable = false, unique = true)
    private String segmentName;

    @Column(name = "table_name", nullable = false, unique = true)
    private String tableName;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "compiled_query", columnDefinition = "TEXT")
    private String compiledQuery;

    @Column(name = "depends_on", columnDefinition = "TEXT")
    private String dependsOn;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", columnDefinition = "varchar(50)")
    private SetOperation operation;

    @Enumerated(EnumType.STRING)
    @Column(name = "refresh_frequency", columnDefinition = "varchar(50)")
    private RefreshSchedule refreshFrequency;

    @Builder.Default
    @Column(name = "row_count")
    private Long rowCount = 0L;

    @Column(name = "last_refreshed_at")
    private LocalDateTime lastRefreshedAt;

    @Column(name = "data_as_of")
    private LocalDateTime dataAsOf;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Version
    private Long version;
}
