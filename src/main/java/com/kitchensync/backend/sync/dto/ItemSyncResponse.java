package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemSyncResponse(
        String syncedAt,
        String operation,   // created / updated / skipped / deleted
        String itemId,
        String reason,      // skipped 時為 stale_update
        JsonNode serverVersion
) {}
