package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kitchensync.backend.sync.dto.BackupExportResponse;
import com.kitchensync.backend.sync.dto.BackupImportRequest;
import com.kitchensync.backend.sync.dto.BackupImportResponse;
import com.kitchensync.backend.sync.dto.SyncStatusResponse;
import com.kitchensync.backend.sync.entity.SyncItemEntity;
import com.kitchensync.backend.sync.entity.UserSyncStateEntity;
import com.kitchensync.backend.sync.gate.SyncFeatureGate;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.store.AbstractSectionStore;
import com.kitchensync.backend.sync.store.PreparedSection;
import com.kitchensync.backend.sync.store.SectionStores;
import com.kitchensync.backend.sync.web.ImportArrayTooLargeException;
import com.kitchensync.backend.sync.web.ImportValidationException;
import com.kitchensync.backend.sync.web.SyncValidationException;
import com.kitchensync.backend.users.user.service.UserAccountService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 同步狀態查詢、整份備份匯出與匯入。
 *
 * <p>匯入流程：陣列大小上限 → 全部驗證（失敗什麼都不寫）→ 方案上限截斷 → 寫正規化 section → blob 合併並蓋章 → 回寫帳號。</p>
 *
 * <ul>
 *   <li>replace：五個正規化 section 與三個陣列 blob 整個換掉（備份裡沒有就清空）；整包 blob 有值才覆寫</li>
 *   <li>merge：既有 item 只有在備份版本比較新時才覆寫；陣列 blob 依 id 取代或附加；整包 blob 遞迴合併</li>
 * </ul>
 *
 * <p>匯入後十二個 section 全部蓋章，其他裝置下次讀取會拿到完整資料。</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncBackupService {

    public static final int BACKUP_VERSION = 1;
    public static final int IMPORT_MAX_ARRAY_SIZE = 10_000;
    public static final String MODE_MERGE = "merge";
    public static final String MODE_REPLACE = "replace";

    static final int MAX_REPORTED_ERRORS = 20;

    private final SectionStores stores;
    private final SyncStateService syncState;
    private final SyncFeatureGate gate;
    private final PreferencesValidator prefsValidator;
    private final UserAccountService accounts;
    private final ObjectMapper om;
    private final Clock clock;

    // ===== 狀態 =====

    public SyncStatusResponse status(Long userId) {
        Instant last = syncState.find(userId).map(UserSyncStateEntity::getLastSyncedAt).orElse(null);

        SyncStatusResponse.DataTypes counts = new SyncStatusResponse.DataTypes(
                stores.get(SyncSection.INVENTORY).count(userId),
                stores.get(SyncSection.RECIPES).count(userId),
                stores.get(SyncSection.MEAL_PLANS).count(userId),
                stores.get(SyncSection.SHOPPING_LIST).count(userId),
                stores.get(SyncSection.COOKWARE).count(userId)
        );
        // 有紀錄且同步過才算一致
        return new SyncStatusResponse(last == null ? null : last.toString(), last != null, counts);
    }

    // ===== 匯出 =====

    public BackupExportResponse export(Long userId) {
        String exportedAt = clock.instant().toString();
        UserSyncStateEntity state = syncState.find(userId).orElse(null);

        ObjectNode data = om.createObjectNode();
        for (SyncSection s : SyncSection.values()) {
            data.set(s.wireName(), exportSection(userId, state, s));
        }

        log.info("sync_export_done userId={} inventory={} recipes={}", userId,
                data.get(SyncSection.INVENTORY.wireName()).size(), data.get(SyncSection.RECIPES.wireName()).size());
        return new BackupExportResponse(BACKUP_VERSION, exportedAt, data);
    }

    private JsonNode exportSection(Long userId, UserSyncStateEntity state, SyncSection s) {
        if (s.isNormalized()) return stores.get(s).exportAll(userId);

        JsonNode v = (state == null) ? null : state.blob(s);
        if (s.kind() == SyncSection.Kind.ARRAY_BLOB) {
            return (v != null && v.isArray()) ? v.deepCopy() : om.createArrayNode();
        }
        return (v == null) ? NullNode.getInstance() : v.deepCopy();
    }

    // ===== 匯入 =====

    public BackupImportResponse importBackup(Long userId, BackupImportRequest req) {
        if (req == null || req.backup() == null) throw new IllegalArgumentException("MISSING_DATA");
        if (req.backup().version() == null || req.backup().version() != BACKUP_VERSION) {
            throw new IllegalArgumentException("UNSUPPORTED_BACKUP_VERSION");
        }
        String mode = req.mode();
        if (!MODE_MERGE.equals(mode) && !MODE_REPLACE.equals(mode)) throw new IllegalArgumentException("INVALID_MODE");

        JsonNode data = req.backup().data();
        if (data == null || !data.isObject()) throw new IllegalArgumentException("MISSING_DATA");
        boolean replace = MODE_REPLACE.equals(mode);
        log.info("sync_import_start userId={} mode={} exportedAt={}", userId, mode, req.backup().exportedAt());

        // 1) 陣列大小
        checkArraySizes(data);

        // 2) 驗證全部內容，任何錯誤都整份拒絕
        List<String> errors = new ArrayList<>();
        Map<SyncSection, PreparedSection<?>> prepared = new EnumMap<>(SyncSection.class);
        for (SyncSection s : SyncSection.normalized()) {
            try {
                prepared.put(s, stores.get(s).prepare(data.get(s.wireName())));
            } catch (SyncValidationException e) {
                for (String err : e.errors()) errors.add(prefixed(s, err));
            }
        }
        for (SyncSection s : SyncSection.blobs()) {
            validateBlob(s, data.get(s.wireName()), errors);
        }
        if (!errors.isEmpty()) {
            log.info("sync_import_rejected userId={} reason=IMPORT_VALIDATION_FAILED errors={}", userId, errors.size());
            throw new ImportValidationException(errors.subList(0, Math.min(errors.size(), MAX_REPORTED_ERRORS)));
        }

        // 3) 方案上限：超過就截斷，不拒絕
        List<String> warnings = new ArrayList<>();
        truncate(prepared, SyncSection.INVENTORY, gate.pantryLimitOrNull(userId), "Inventory", warnings);
        truncate(prepared, SyncSection.COOKWARE, gate.cookwareLimitOrNull(userId), "Cookware", warnings);

        JsonNode customLocations = data.get(SyncSection.CUSTOM_LOCATIONS.wireName());
        if (SyncWriteService.isNonEmpty(customLocations) && !gate.canUseCustomStorageAreas(userId)) {
            warnings.add("Custom locations skipped (plan does not include custom storage areas)");
            customLocations = null;
        }

        // 4) 正規化 section
        Instant itemStamp = syncState.peekNextStamp(userId);
        for (SyncSection s : SyncSection.normalized()) {
            AbstractSectionStore<?> store = stores.get(s);
            PreparedSection<?> p = prepared.get(s);
            if (replace) {
                store.replaceAll(userId, p, itemStamp);
            } else {
                var c = store.upsertIfNewer(userId, p, SyncBackupService::importedUpdatedAt, itemStamp);
                log.debug("sync_import_section userId={} section={} inserted={} updated={} skipped={}",
                        userId, s.wireName(), c.inserted(), c.updated(), c.skipped());
            }
        }

        // 5) blob + 全部 section 蓋章
        final JsonNode incomingCustom = customLocations;
        var stamped = syncState.applyAndStamp(userId, List.of(SyncSection.values()), (state, now) -> {
            for (SyncSection s : SyncSection.blobs()) {
                JsonNode incoming = (s == SyncSection.CUSTOM_LOCATIONS) ? incomingCustom : data.get(s.wireName());
                state.putBlob(s, importBlob(s, state.blob(s), incoming, replace));
            }
        });
        UserSyncStateEntity state = stamped.state();

        // 6) 回寫帳號列
        if (present(data.get(SyncSection.PREFERENCES.wireName()))) {
            PreferencesValidator.Result merged = prefsValidator.validate(state.getPreferences());
            if (merged.isValid()) {
                accounts.applyPreferences(userId, merged.preferences());
            } else {
                log.warn("sync_import_prefs_not_projected userId={} error={}", userId, merged.error());
            }
        }
        if (present(data.get(SyncSection.ONBOARDING.wireName()))
                && SyncWriteService.onboardingCompleted(state.getOnboarding())) {
            accounts.markOnboardingCompleted(userId);
        }

        Map<String, Object> summary = summarize(userId, state);
        log.info("sync_import_done userId={} mode={} warnings={}", userId, mode, warnings.size());
        return new BackupImportResponse(mode, stamped.stampedAt().toString(), summary,
                warnings.isEmpty() ? null : warnings);
    }

    private static void checkArraySizes(JsonNode data) {
        List<ImportArrayTooLargeException.Violation> violations = new ArrayList<>();
        for (SyncSection s : SyncSection.values()) {
            if (s.kind() == SyncSection.Kind.VALUE_BLOB) continue;
            JsonNode v = data.get(s.wireName());
            if (v != null && v.isArray() && v.size() > IMPORT_MAX_ARRAY_SIZE) {
                violations.add(new ImportArrayTooLargeException.Violation(s.wireName(), v.size()));
            }
        }
        if (!violations.isEmpty()) throw new ImportArrayTooLargeException(IMPORT_MAX_ARRAY_SIZE, violations);
    }

    private void validateBlob(SyncSection s, JsonNode v, List<String> errors) {
        if (!present(v)) return;

        if (s == SyncSection.PREFERENCES) {
            PreferencesValidator.Result r = prefsValidator.validate(v);
            if (!r.isValid()) errors.add(s.wireName() + ": " + r.error());
            return;
        }
        if (s.kind() == SyncSection.Kind.ARRAY_BLOB) {
            if (!v.isArray()) {
                errors.add(s.wireName() + ": expected array");
                return;
            }
            for (int i = 0; i < v.size(); i++) {
                if (!v.get(i).isObject()) errors.add(s.wireName() + "[" + i + "]: expected object");
            }
            return;
        }
        if (!v.isObject()) errors.add(s.wireName() + ": expected object");
    }

    private static String prefixed(SyncSection s, String err) {
        return err.startsWith("[") ? s.wireName() + err : s.wireName() + ": " + err;
    }

    private static void truncate(Map<SyncSection, PreparedSection<?>> prepared, SyncSection s, Integer limit,
                                 String label, List<String> warnings) {
        PreparedSection<?> p = prepared.get(s);
        if (limit == null || p.size() <= limit) return;

        prepared.put(s, p.limitNewItems(Set.of(), limit));
        warnings.add(label + " truncated from " + p.size() + " to " + limit + " items (plan limit)");
    }

    static JsonNode importBlob(SyncSection s, JsonNode before, JsonNode incoming, boolean replace) {
        if (s.kind() == SyncSection.Kind.ARRAY_BLOB) {
            if (replace) {
                return (incoming != null && incoming.isArray()) ? incoming.deepCopy() : JsonNodeFactory.instance.arrayNode();
            }
            return BlobMerge.upsertById(before, incoming);
        }
        if (!present(incoming)) return before;
        return replace ? incoming.deepCopy() : BlobMerge.deepMerge(before, incoming);
    }

    /** 備份裡 item 的 updatedAt；沒有或無法解析時回 null（視為最舊） */
    static Instant importedUpdatedAt(SyncItemEntity item) {
        JsonNode extra = item.getExtraData();
        JsonNode v = (extra == null) ? null : extra.get(AbstractSectionStore.UPDATED_AT_KEY);
        if (v == null || v.isNull()) return null;
        if (v.isIntegralNumber()) return Instant.ofEpochMilli(v.longValue());
        if (!v.isTextual()) return null;
        try {
            return OffsetDateTime.parse(v.asText().trim()).toInstant();
        } catch (DateTimeException e) {
            log.debug("sync_import_updatedAt_unparseable itemId={} value={}", item.getItemId(), v.asText());
            return null;
        }
    }

    private Map<String, Object> summarize(Long userId, UserSyncStateEntity state) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (SyncSection s : SyncSection.values()) {
            if (s.isNormalized()) {
                out.put(s.wireName(), stores.get(s).count(userId));
            } else if (s == SyncSection.WASTE_LOG || s == SyncSection.CONSUMED_LOG) {
                JsonNode v = state.blob(s);
                out.put(s.wireName(), (v != null && v.isArray()) ? v.size() : 0);
            } else {
                out.put(s.wireName(), SyncWriteService.isNonEmpty(state.blob(s)));
            }
        }
        return out;
    }

    private static boolean present(JsonNode v) {
        return v != null && !v.isNull();
    }
}
