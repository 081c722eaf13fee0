package com.billing.common.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        int statusCode,
        String error,
        String code,
        String message,
        String path,
        String requestId,
        Instant timestamp,
        Map<String, Object> details
) {}
