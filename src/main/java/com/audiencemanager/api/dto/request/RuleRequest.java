package com.audiencemanager.api.dto.request;

import com.audiencemanager.domain.enums.RefreshSchedule;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * REST API request DTO for creating a rule.
 *
 * <p>{@code conditions} is left untyped: clients send either the condition list or the
 * legacy flat dictionary, and {@code ConditionInputAdapter} normalizes both.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RuleRequest {

    @NotBlank
    @Size(max = 255)
    private String name;

    private String description;

    private Object conditions;

    private RefreshSchedule schedule;

    private Boolean active;
}
