package com.audiencemanager.domain.model;

import com.audiencemanager.domain.enums.RunStatus;
import com.audiencemanager.domain.enums.RunTrigger;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Outcome of one materialization of a rule's segment, also kept as run history.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MaterializationRun {

    private Long id;
    private Long ruleId;
    private RunTrigger trigger;
    private RunStatus status;
    private Long rowCount;
    private String message;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;

    public boolean isSuccess() {
        return status != null && status.isSuccess();
    }
}
