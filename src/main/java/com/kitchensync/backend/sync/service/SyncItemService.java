package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.kitchensync.backend.sync.dto.ItemPageResponse;
import com.kitchensync.backend.sync.dto.ItemSyncResponse;
import com.kitchensync.backend.sync.gate.SyncFeatureGate;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.store.AbstractSectionStore;
import com.kitchensync.backend.sync.store.AbstractSectionStore.UpsertOutcome;
import com.kitchensync.backend.sync.store.PageCursor;
import com.kitchensync.backend.sync.store.PreparedSection;
import com.kitchensync.backend.sync.store.SectionStores;
import com.kitchensync.backend.sync.web.CookwareLimitExceededException;
import com.kitchensync.backend.sync.web.PantryLimitExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * 單筆 item 的新增/更新/刪除，以及單一 section 的分頁讀取。
 * 寫入後一樣推進 sectionTimestamps，其他裝置的差異讀取才看得到。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncItemService {

    public static final String OP_DELETED = "deleted";
    public static final String REASON_STALE = "stale_update";

    static final int DEFAULT_PAGE_LIMIT = 50;
    static final int MAX_PAGE_LIMIT = 100;

    private final SectionStores stores;
    private final SyncStateService syncState;
    private final SyncFeatureGate gate;
    private final Clock clock;

    /**
     * 單一 section 的游標分頁（inventory 不含軟刪除的 item）。
     * limit 預設 50、最多 100。
     */
    public ItemPageResponse list(Long userId, String sectionName, Integer limit, String cursor) {
        SyncSection section = requireNormalized(sectionName);

        int size = (limit == null) ? DEFAULT_PAGE_LIMIT : limit;
        if (size < 1 || size > MAX_PAGE_LIMIT) throw new IllegalArgumentException("INVALID_LIMIT");

        PageCursor after = null;
        if (cursor != null && !cursor.isBlank()) {
            after = PageCursor.decodeOrNull(cursor);
            if (after == null) {
                log.info("sync_list_rejected userId={} section={} reason=INVALID_CURSOR", userId, sectionName);
                throw new IllegalArgumentException("INVALID_CURSOR");
            }
        }

        AbstractSectionStore.ItemPage page = stores.get(section).page(userId, size, after);
        return new ItemPageResponse(page.items(), page.next() == null ? null : page.next().encode());
    }

    public ItemSyncResponse upsert(Long userId, String sectionName, JsonNode item, String clientTimestamp) {
        SyncSection section = requireNormalized(sectionName);
        if (item == null || !item.isObject()) throw new IllegalArgumentException("MISSING_DATA");

        AbstractSectionStore<?> store = stores.get(section);
        PreparedSection<?> prepared = store.prepareOne(item);
        String itemId = prepared.items().get(0).getItemId();

        // 只有新增才佔名額
        if (section == SyncSection.COOKWARE && !store.exists(userId, itemId)) {
            Integer limit = gate.cookwareLimitOrNull(userId);
            long count = store.count(userId);
            if (limit != null && count >= limit) {
                log.info("sync_item_rejected userId={} reason=COOKWARE_LIMIT_REACHED limit={} count={}", userId, limit, count);
                throw new CookwareLimitExceededException(limit, (int) count);
            }
        }
        if (section == SyncSection.INVENTORY && !store.exists(userId, itemId)) {
            Integer limit = gate.pantryLimitOrNull(userId);
            long count = store.count(userId);
            if (limit != null && count >= limit) {
                log.info("sync_item_rejected userId={} reason=PANTRY_LIMIT_REACHED limit={} count={}", userId, limit, count);
                throw new PantryLimitExceededException(limit);
            }
        }

        Instant incomingAt = incomingTimestamp(item, clientTimestamp);
        Instant stamp = syncState.peekNextStamp(userId);
        UpsertOutcome outcome = store.upsertOne(userId, prepared, incomingAt, stamp);

        if (outcome.isSkipped()) {
            log.info("sync_item_skipped userId={} section={} itemId={} reason={}", userId, sectionName, itemId, REASON_STALE);
            return new ItemSyncResponse(clock.instant().toString(), outcome.operation(), itemId, REASON_STALE, outcome.serverVersion());
        }

        var stamped = syncState.applyAndStamp(userId, List.of(section), (state, now) -> { });
        return new ItemSyncResponse(stamped.stampedAt().toString(), outcome.operation(), itemId, null, null);
    }

    public ItemSyncResponse delete(Long userId, String sectionName, String itemId) {
        SyncSection section = requireNormalized(sectionName);
        if (itemId == null || itemId.isBlank()) throw new IllegalArgumentException("ITEM_ID_REQUIRED");

        boolean removed = stores.get(section).deleteOne(userId, itemId);
        var stamped = syncState.applyAndStamp(userId, List.of(section), (state, now) -> { });
        log.info("sync_item_deleted userId={} section={} itemId={} removed={}", userId, sectionName, itemId, removed);
        return new ItemSyncResponse(stamped.stampedAt().toString(), OP_DELETED, itemId, null, null);
    }

    private static SyncSection requireNormalized(String name) {
        return SyncSection.fromWireName(name)
                .filter(SyncSection::isNormalized)
                .orElseThrow(() -> new IllegalArgumentException("UNKNOWN_SECTION"));
    }

    /** data.updatedAt 優先，其次 clientTimestamp，都沒有（或解析失敗）就用現在 */
    Instant incomingTimestamp(JsonNode item, String clientTimestamp) {
        JsonNode u = item.get("updatedAt");
        if (u != null && u.isTextual()) {
            Instant t = parseOrNull(u.asText());
            if (t != null) return t;
        }
        if (u != null && u.isIntegralNumber()) return Instant.ofEpochMilli(u.longValue());
        if (clientTimestamp != null) {
            Instant t = parseOrNull(clientTimestamp);
            if (t != null) return t;
        }
        return clock.instant();
    }

    private static Instant parseOrNull(String raw) {
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("sync_item_timestamp_unparseable value={}", raw);
            return null;
        }
    }
}
