package com.audiencemanager.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Acknowledgement of a manual run request; the run itself happens asynchronously. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TriggerResponse {

    private Long ruleId;
    private String message;
}
