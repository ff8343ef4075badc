package com.kitchensync.backend.sync.controller;

import com.kitchensync.backend.auth.security.AuthContext;
import com.kitchensync.backend.common.web.ApiResponse;
import com.kitchensync.backend.sync.dto.GuestMergeRequest;
import com.kitchensync.backend.sync.dto.GuestMergeResponse;
import com.kitchensync.backend.sync.dto.ItemPageResponse;
import com.kitchensync.backend.sync.dto.ItemSyncResponse;
import com.kitchensync.backend.sync.dto.ItemUpsertRequest;
import com.kitchensync.backend.sync.dto.SyncReadResponse;
import com.kitchensync.backend.sync.dto.SyncWriteRequest;
import com.kitchensync.backend.sync.dto.SyncWriteResponse;
import com.kitchensync.backend.sync.service.GuestDataMergeService;
import com.kitchensync.backend.sync.service.SyncItemService;
import com.kitchensync.backend.sync.service.SyncReadService;
import com.kitchensync.backend.sync.service.SyncWriteService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Sync", description = "Multi-device sync: delta read, full replace, guest merge, item-level writes")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1")
public class SyncController {

    private final AuthContext auth;
    private final SyncReadService readService;
    private final SyncWriteService writeService;
    private final GuestDataMergeService mergeService;
    private final SyncItemService itemService;

    @GetMapping("/sync")
    public ApiResponse<SyncReadResponse> read(@RequestParam(value = "lastSyncedAt", required = false) String lastSyncedAt) {
        Long uid = auth.requireUserId();
        return ApiResponse.ok(readService.read(uid, lastSyncedAt));
    }

    @PostMapping("/sync")
    public ApiResponse<SyncWriteResponse> write(@RequestBody(required = false) SyncWriteRequest req) {
        Long uid = auth.requireUserId();
        return ApiResponse.ok(writeService.write(uid, req == null ? null : req.data()));
    }

    /** 訪客轉正式帳號後呼叫一次；同一個 guestId 重送不會重複併入 */
    @PostMapping("/migrate-guest-data")
    public ApiResponse<GuestMergeResponse> migrateGuestData(@RequestBody(required = false) GuestMergeRequest req) {
        Long uid = auth.requireUserId();
        if (req == null) throw new IllegalArgumentException("MISSING_DATA");
        return ApiResponse.ok(mergeService.merge(uid, req.guestId(), req.data()));
    }

    @GetMapping("/sync/{section}/items")
    public ApiResponse<ItemPageResponse> listItems(@PathVariable("section") String section,
                                                   @RequestParam(value = "limit", required = false) Integer limit,
                                                   @RequestParam(value = "cursor", required = false) String cursor) {
        Long uid = auth.requireUserId();
        return ApiResponse.ok(itemService.list(uid, section, limit, cursor));
    }

    @PutMapping("/sync/{section}/items")
    public ApiResponse<ItemSyncResponse> upsertItem(@PathVariable("section") String section,
                                                    @RequestBody(required = false) ItemUpsertRequest req) {
        Long uid = auth.requireUserId();
        if (req == null) throw new IllegalArgumentException("MISSING_DATA");
        return ApiResponse.ok(itemService.upsert(uid, section, req.data(), req.clientTimestamp()));
    }

    @DeleteMapping("/sync/{section}/items/{itemId}")
    public ApiResponse<ItemSyncResponse> deleteItem(@PathVariable("section") String section,
                                                    @PathVariable("itemId") String itemId) {
        Long uid = auth.requireUserId();
        return ApiResponse.ok(itemService.delete(uid, section, itemId));
    }
}
