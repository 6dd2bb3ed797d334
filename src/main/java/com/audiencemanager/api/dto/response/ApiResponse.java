package com.audiencemanager.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/**
 * Success envelope around every rule and segment payload. List payloads also carry
 * {@code count} so callers can size catalog listings without walking {@code data}.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Integer count;
    private final Instant timestamp = Instant.now();

    private ApiResponse(T data, Integer count) {
        this.data = data;
        this.count = count;
    }

    public static <T> ApiResponse<T> of(T data) {
        Integer count = data instanceof Collection<?> collection ? collection.size() : null;
        return new ApiResponse<>(data, count);
    }
}
