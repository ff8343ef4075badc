package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * data：完整或差異資料；unchanged 時為 null。
 * lastSyncedAt 沒有紀錄時為 null，但欄位一定輸出。
 */
public record SyncReadResponse(
        JsonNode data,
        @JsonInclude(JsonInclude.Include.NON_NULL) Boolean unchanged,
        @JsonInclude(JsonInclude.Include.NON_NULL) Boolean delta,
        String serverTimestamp,
        String lastSyncedAt
) {
    public static SyncReadResponse full(JsonNode data, String serverTimestamp, String lastSyncedAt) {
        return new SyncReadResponse(data, null, null, serverTimestamp, lastSyncedAt);
    }

    public static SyncReadResponse delta(JsonNode data, String serverTimestamp, String lastSyncedAt) {
        return new SyncReadResponse(data, null, true, serverTimestamp, lastSyncedAt);
    }

    public static SyncReadResponse unchanged(String serverTimestamp, String lastSyncedAt) {
        return new SyncReadResponse(null, true, null, serverTimestamp, lastSyncedAt);
    }
}
