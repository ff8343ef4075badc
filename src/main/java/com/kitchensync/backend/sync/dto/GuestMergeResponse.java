package com.kitchensync.backend.sync.dto;

public record GuestMergeResponse(
        String migratedAt,
        boolean merged
) {}
