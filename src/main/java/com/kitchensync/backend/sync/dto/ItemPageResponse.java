package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

public record ItemPageResponse(
        JsonNode items,
        @JsonInclude(JsonInclude.Include.NON_NULL) String nextCursor   // 最後一頁沒有
) {}
