package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record ItemUpsertRequest(
        JsonNode data,
        String clientTimestamp
) {}
