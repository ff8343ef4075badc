package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

public record BackupImportResponse(
        String mode,
        String importedAt,
        Map<String, Object> summary,   // 正規化 section 與 log 是筆數，其餘是「有沒有資料」
        @JsonInclude(JsonInclude.Include.NON_NULL) List<String> warnings
) {}
