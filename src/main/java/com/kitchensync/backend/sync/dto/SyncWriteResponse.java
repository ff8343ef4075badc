package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

public record SyncWriteResponse(
        String syncedAt,
        boolean prefsSynced,
        @JsonInclude(JsonInclude.Include.NON_NULL) String prefsError
) {}
