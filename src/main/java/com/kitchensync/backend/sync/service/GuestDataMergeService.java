package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.kitchensync.backend.sync.dto.GuestMergeResponse;
import com.kitchensync.backend.sync.entity.UserSyncStateEntity;
import com.kitchensync.backend.sync.gate.SyncFeatureGate;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.store.AbstractSectionStore;
import com.kitchensync.backend.sync.store.PreparedSection;
import com.kitchensync.backend.sync.store.SectionStores;
import com.kitchensync.backend.users.user.service.UserAccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 訪客資料併入帳號：不會刪掉帳號既有的任何資料。
 *
 * <ul>
 *   <li>正規化 section：逐筆 upsert，payload 沒提到的 item 不動</li>
 *   <li>陣列 blob（wasteLog / consumedLog / customLocations）：依 id 附加</li>
 *   <li>整包 blob（preferences / onboarding / userProfile）：先寫先贏；analytics 不併</li>
 *   <li>blob 內容沒變就不蓋章</li>
 *   <li>功能門檻不擋請求：cookware 截到剩餘名額、不可用的自訂位置直接丟掉</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GuestDataMergeService {

    private final SectionStores stores;
    private final SyncStateService syncState;
    private final SyncFeatureGate gate;
    private final PreferencesValidator prefsValidator;
    private final UserAccountService accounts;

    public GuestMergeResponse merge(Long userId, String guestId, JsonNode data) {
        if (data == null || !data.isObject()) throw new IllegalArgumentException("MISSING_DATA");

        String gid = (guestId == null || guestId.isBlank()) ? null : guestId.trim();
        log.info("guest_merge_start userId={} guestId={}", userId, gid);

        // 同一個 guest session 只併一次
        Optional<UserSyncStateEntity> existing = syncState.find(userId);
        if (gid != null && existing.isPresent()
                && gid.equals(existing.get().getGuestId())
                && existing.get().getGuestMigratedAt() != null) {
            log.info("guest_merge_skipped userId={} guestId={} reason=ALREADY_MIGRATED", userId, gid);
            return new GuestMergeResponse(existing.get().getGuestMigratedAt().toString(), true);
        }

        // 1) 先驗證所有正規化 section
        Map<SyncSection, PreparedSection<?>> prepared = new EnumMap<>(SyncSection.class);
        for (SyncSection s : SyncSection.normalized()) {
            if (data.has(s.wireName())) {
                prepared.put(s, stores.get(s).prepare(data.get(s.wireName())));
            }
        }

        // 2) cookware 超過名額就截斷（既有 id 不佔名額）
        PreparedSection<?> cookware = prepared.get(SyncSection.COOKWARE);
        if (cookware != null && !cookware.isEmpty()) {
            prepared.put(SyncSection.COOKWARE, degradeCookware(userId, cookware));
        }

        // 3) 自訂儲存位置：沒權限就丟掉
        JsonNode customLocations = data.get(SyncSection.CUSTOM_LOCATIONS.wireName());
        if (SyncWriteService.isNonEmpty(customLocations) && !gate.canUseCustomStorageAreas(userId)) {
            log.info("guest_merge_degraded userId={} dropped={}", userId, SyncSection.CUSTOM_LOCATIONS.wireName());
            customLocations = null;
        }

        // 4) preferences 只有合法才會被採用
        PreferencesValidator.Result prefs = null;
        if (data.has(SyncSection.PREFERENCES.wireName())) {
            prefs = prefsValidator.validate(data.get(SyncSection.PREFERENCES.wireName()));
            if (!prefs.isValid()) {
                log.warn("guest_merge_prefs_invalid userId={} error={}", userId, prefs.error());
            }
        }

        // 5) 正規化 section 逐筆 upsert
        Instant itemStamp = syncState.peekNextStamp(userId);
        List<SyncSection> touched = new ArrayList<>();
        for (var e : prepared.entrySet()) {
            if (e.getValue().isEmpty()) continue;
            AbstractSectionStore.UpsertCounts c = stores.get(e.getKey()).upsertAll(userId, e.getValue(), itemStamp);
            log.debug("guest_merge_section userId={} section={} inserted={} updated={}",
                    userId, e.getKey().wireName(), c.inserted(), c.updated());
            touched.add(e.getKey());
        }

        // 6) blob 合併；只有內容真的變了才蓋章
        final JsonNode incomingCustom = customLocations;
        final PreferencesValidator.Result prefsResult = prefs;
        final boolean[] prefsAdopted = {false};
        final boolean[] onboardingAdopted = {false};
        final List<SyncSection> changedBlobs = new ArrayList<>();
        List<SyncSection> blobSections = blobSectionsToMerge(data, incomingCustom, prefsResult);

        var stamped = syncState.applyAndStamp(userId, touched, (state, now) -> {
            // 撞到第一筆紀錄的競態時會重跑
            prefsAdopted[0] = false;
            onboardingAdopted[0] = false;
            changedBlobs.clear();

            for (SyncSection s : blobSections) {
                JsonNode incoming = (s == SyncSection.CUSTOM_LOCATIONS) ? incomingCustom : data.get(s.wireName());
                JsonNode before = state.blob(s);
                JsonNode after = (s.kind() == SyncSection.Kind.ARRAY_BLOB)
                        ? BlobMerge.appendById(before, incoming)
                        : BlobMerge.firstWriteWins(before, incoming);
                if (Objects.equals(before, after)) continue;

                state.putBlob(s, after);
                changedBlobs.add(s);
                if (s == SyncSection.PREFERENCES) prefsAdopted[0] = true;
                if (s == SyncSection.ONBOARDING) onboardingAdopted[0] = true;
            }
            state.stampSections(changedBlobs, now);

            // 重送同一個 guestId 時原樣回傳這次的時間
            if (gid != null) {
                state.setGuestId(gid);
                state.setGuestMigratedAt(now);
            }
        });
        touched.addAll(changedBlobs);

        if (prefsAdopted[0]) accounts.applyPreferences(userId, prefsResult.preferences());
        if (onboardingAdopted[0] && SyncWriteService.onboardingCompleted(data.get(SyncSection.ONBOARDING.wireName()))) {
            accounts.markOnboardingCompleted(userId);
        }

        log.info("guest_merge_done userId={} guestId={} sections={} merged={}",
                userId, gid, touched.size(), stamped.existedBefore());
        return new GuestMergeResponse(stamped.stampedAt().toString(), stamped.existedBefore());
    }

    private PreparedSection<?> degradeCookware(Long userId, PreparedSection<?> incoming) {
        Integer limit = gate.cookwareLimitOrNull(userId);
        if (limit == null) return incoming;

        var store = stores.cookware();
        Set<String> already = store.existingItemIds(userId, incoming.itemIds());
        int remaining = (int) Math.max(0, limit - store.count(userId));

        PreparedSection<?> kept = incoming.limitNewItems(already, remaining);
        if (kept.size() < incoming.size()) {
            log.info("guest_merge_degraded userId={} section=cookware limit={} incoming={} kept={}",
                    userId, limit, incoming.size(), kept.size());
        }
        return kept;
    }

    /** analytics 是裝置自己的統計，不從訪客帶過來 */
    private static List<SyncSection> blobSectionsToMerge(JsonNode data, JsonNode customLocations,
                                                         PreferencesValidator.Result prefs) {
        List<SyncSection> out = new ArrayList<>();
        for (SyncSection s : SyncSection.blobs()) {
            if (s == SyncSection.ANALYTICS) continue;
            JsonNode v = (s == SyncSection.CUSTOM_LOCATIONS) ? customLocations : data.get(s.wireName());
            if (v == null || v.isNull()) continue;
            if (s == SyncSection.PREFERENCES && (prefs == null || !prefs.isValid())) continue;
            out.add(s);
        }
        return out;
    }
}
