package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncErrorResponse(
        String code,
        String message,
        String requestId,
        Map<String, Object> details
) {
    public SyncErrorResponse(String code, String message, String requestId) {
        this(code, message, requestId, null);
    }
}
