package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.databind.JsonNode;

public record GuestMergeRequest(
        String guestId,   // 可選；同一個 guestId 只會併入一次
        JsonNode data
) {}
