package com.audiencemanager.domain.model;

import com.audiencemanager.domain.enums.SetOperation;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LineageNode {

    private Long ruleId;
    private Long segmentId;
    private String segmentName;
    private String tableName;
    private SetOperation operation;
    private Long rowCount;
    private LocalDateTime lastRefreshedAt;
    private boolean composite;
}
