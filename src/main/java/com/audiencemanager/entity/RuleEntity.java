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
 * JPA entity for the rules table.
 *
 * <p>Condition lists and dependency ids are stored as JSON text. For a composite rule
 * {@code conditions} holds only the residual conditions and {@code dependencies} +
 * {@code operation} are set; {@code declaredConditions} always holds the full list the
 * rule was declared with.
 */
@Entity
@Table(name = "rules")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "conditions", columnDefinition = "TEXT")
    private String conditions;

    @Column(name = "declared_conditions", columnDefinition = "TEXT")
    private String declaredConditions;

    // Composite rules only
    @Column(name = "dependencies", columnDefinition = "TEXT")
    private String dependencies;

    @Enumerated(EnumType.STRING)
    @Column(name = "operation", columnDefinition = "varchar(50)")
    private SetOperation operation;

    // Scheduling
    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule", nullable = false, columnDefinition = "varchar(50)")
    private RefreshSchedule schedule;

    @Column(name = "next_run_at")
    private LocalDateTime nextRunAt;

    @Column(name = "last_run_at")
    private LocalDateTime lastRunAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;
}
