package com.audiencemanager.api.dto.response;

import com.audiencemanager.domain.enums.RunStatus;
import com.audiencemanager.domain.enums.RunTrigger;
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
public class MaterializationRunResponse {

    private Long id;
    private Long ruleId;
    private RunTrigger trigger;
    private RunStatus status;
    private boolean success;
    private Long rowCount;
    private String message;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
}
