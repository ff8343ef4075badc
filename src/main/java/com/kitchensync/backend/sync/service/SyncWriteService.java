package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.kitchensync.backend.sync.dto.SyncWriteResponse;
import com.kitchensync.backend.sync.gate.SyncFeatureGate;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.store.PreparedSection;
import com.kitchensync.backend.sync.store.SectionStores;
import com.kitchensync.backend.sync.web.CookwareLimitExceededException;
import com.kitchensync.backend.sync.web.FeatureNotAvailableException;
import com.kitchensync.backend.users.user.service.UserAccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 完整取代寫入：payload 裡有的 section 整個換掉，沒有的不動。
 *
 * <p>順序：功能門檻 → preferences 驗證 → 所有 item 驗證 → 逐 section 寫入 → 紀錄蓋章 → 回寫帳號。
 * 門檻和 item 驗證失敗時什麼都不會寫。各 section 各自一個 transaction，整份 payload 不是一起 atomic。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncWriteService {

    private final SectionStores stores;
    private final SyncStateService syncState;
    private final SyncFeatureGate gate;
    private final PreferencesValidator prefsValidator;
    private final UserAccountService accounts;

    public SyncWriteResponse write(Long userId, JsonNode data) {
        if (data == null || !data.isObject()) throw new IllegalArgumentException("MISSING_DATA");

        // 1) 功能門檻（寫入前就擋）
        checkGates(userId, data);

        // 2) preferences：驗證失敗不中斷，只是不存
        PreferencesValidator.Result prefs = null;
        if (present(data, SyncSection.PREFERENCES)) {
            prefs = prefsValidator.validate(data.get(SyncSection.PREFERENCES.wireName()));
            if (!prefs.isValid()) {
                log.warn("sync_prefs_invalid userId={} error={}", userId, prefs.error());
            }
        }

        // 3) 先驗證所有正規化 section，任何一個失敗就整批拒絕
        Map<SyncSection, PreparedSection<?>> prepared = new EnumMap<>(SyncSection.class);
        for (SyncSection s : SyncSection.normalized()) {
            if (data.has(s.wireName())) {
                prepared.put(s, stores.get(s).prepare(data.get(s.wireName())));
            }
        }

        // 4) 逐 section 整批取代
        Instant itemStamp = syncState.peekNextStamp(userId);
        for (var e : prepared.entrySet()) {
            stores.get(e.getKey()).replaceAll(userId, e.getValue(), itemStamp);
        }

        // 5) blob 原樣存，加上蓋章
        List<SyncSection> written = new ArrayList<>(prepared.keySet());
        final PreferencesValidator.Result prefsResult = prefs;
        List<SyncSection> blobs = new ArrayList<>();
        for (SyncSection s : SyncSection.blobs()) {
            if (!data.has(s.wireName())) continue;
            if (s == SyncSection.PREFERENCES && !prefsResult.isValid()) continue;
            blobs.add(s);
        }
        written.addAll(blobs);

        var stamped = syncState.applyAndStamp(userId, written, (state, now) -> {
            for (SyncSection s : blobs) {
                state.putBlob(s, data.get(s.wireName()).deepCopy());
            }
        });

        // 6) 回寫帳號列
        if (prefsResult != null && prefsResult.isValid()) {
            accounts.applyPreferences(userId, prefsResult.preferences());
        }
        if (onboardingCompleted(data.get(SyncSection.ONBOARDING.wireName()))) {
            accounts.markOnboardingCompleted(userId);
        }

        log.info("sync_write_done userId={} sections={} prefsSynced={}", userId, written.size(),
                prefsResult == null || prefsResult.isValid());

        return new SyncWriteResponse(
                stamped.stampedAt().toString(),
                prefsResult == null || prefsResult.isValid(),
                prefsResult == null ? null : prefsResult.error()
        );
    }

    private void checkGates(Long userId, JsonNode data) {
        JsonNode cookware = data.get(SyncSection.COOKWARE.wireName());
        if (cookware != null && cookware.isArray()) {
            Integer limit = gate.cookwareLimitOrNull(userId);
            if (limit != null && cookware.size() > limit) {
                log.info("sync_rejected userId={} reason=COOKWARE_LIMIT_REACHED limit={} count={}", userId, limit, cookware.size());
                throw new CookwareLimitExceededException(limit, cookware.size());
            }
        }

        JsonNode custom = data.get(SyncSection.CUSTOM_LOCATIONS.wireName());
        if (isNonEmpty(custom) && !gate.canUseCustomStorageAreas(userId)) {
            log.info("sync_rejected userId={} reason=FEATURE_NOT_AVAILABLE feature={}", userId, SyncFeatureGate.FEATURE_CUSTOM_STORAGE_AREAS);
            throw new FeatureNotAvailableException(SyncFeatureGate.FEATURE_CUSTOM_STORAGE_AREAS);
        }
    }

    private static boolean present(JsonNode data, SyncSection s) {
        return data.has(s.wireName());
    }

    static boolean isNonEmpty(JsonNode v) {
        if (v == null || v.isNull()) return false;
        if (v.isContainerNode()) return v.size() > 0;
        return true;
    }

    static boolean onboardingCompleted(JsonNode onboarding) {
        if (onboarding == null || !onboarding.isObject()) return false;
        JsonNode c = onboarding.get("completedAt");
        return c != null && !c.isNull();
    }
}
