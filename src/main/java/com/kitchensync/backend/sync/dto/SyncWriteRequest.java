package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.databind.JsonNode;

/** data 的 key 是 section wire name 的任意子集 */
public record SyncWriteRequest(JsonNode data) {}
