package com.audiencemanager.api.dto.request;

import com.audiencemanager.domain.enums.RefreshSchedule;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Partial rule update; absent fields keep their current value. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleUpdateRequest {

    @Size(min = 1, max = 255)
    private String name;

    private String description;

    private Object conditions;

    private RefreshSchedule schedule;

    private Boolean active;
}
