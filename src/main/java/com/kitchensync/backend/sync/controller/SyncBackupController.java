package com.kitchensync.backend.sync.controller;

import com.kitchensync.backend.auth.security.AuthContext;
import com.kitchensync.backend.common.web.ApiResponse;
import com.kitchensync.backend.sync.dto.BackupExportResponse;
import com.kitchensync.backend.sync.dto.BackupImportRequest;
import com.kitchensync.backend.sync.dto.BackupImportResponse;
import com.kitchensync.backend.sync.dto.SyncStatusResponse;
import com.kitchensync.backend.sync.service.SyncBackupService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Sync Backup", description = "Sync status, full backup export and import")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/sync")
public class SyncBackupController {

    private final AuthContext auth;
    private final SyncBackupService backupService;

    @GetMapping("/status")
    public ApiResponse<SyncStatusResponse> status() {
        Long uid = auth.requireUserId();
        return ApiResponse.ok(backupService.status(uid));
    }

    @GetMapping("/export")
    public ApiResponse<BackupExportResponse> export() {
        Long uid = auth.requireUserId();
        return ApiResponse.ok(backupService.export(uid));
    }

    @PostMapping("/import")
    public ApiResponse<BackupImportResponse> importBackup(@Valid @RequestBody BackupImportRequest req) {
        Long uid = auth.requireUserId();
        return ApiResponse.ok(backupService.importBackup(uid, req));
    }
}
