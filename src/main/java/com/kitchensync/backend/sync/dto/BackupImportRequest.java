package com.kitchensync.backend.sync.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record BackupImportRequest(
        @NotNull(message = "backup is required") @Valid Backup backup,
        @NotNull(message = "mode is required")
        @Pattern(regexp = "merge|replace", message = "mode must be merge or replace") String mode
) {
    public record Backup(
            @NotNull(message = "version is required")
            @Min(value = 1, message = "unsupported backup version")
            @Max(value = 1, message = "unsupported backup version") Integer version,
            @NotBlank(message = "exportedAt is required") String exportedAt,
            @NotNull(message = "data is required") JsonNode data
    ) {}
}
