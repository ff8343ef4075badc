package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record BackupExportResponse(
        int version,
        String exportedAt,
        JsonNode data
) {}
