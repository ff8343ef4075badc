package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kitchensync.backend.sync.dto.SyncReadResponse;
import com.kitchensync.backend.sync.entity.UserSyncStateEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.store.SectionStores;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 讀取路徑：依 client 的 watermark 決定回 unchanged、差異資料或完整資料。
 *
 * <ul>
 *   <li>沒有紀錄：四個清單 section 給空陣列，cookware 照讀，lastSyncedAt = null</li>
 *   <li>沒帶 watermark 或格式錯誤：完整資料</li>
 *   <li>updatedAt ≤ watermark：unchanged，不讀任何 section</li>
 *   <li>其餘：只帶 sectionTimestamps 比 watermark 新的 section；cookware 一律帶</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncReadService {

    private static final List<Function<String, Instant>> WATERMARK_FORMATS = List.of(
            // ISO_OFFSET_DATE_TIME 同時接受 Z 與 +08:00
            v -> OffsetDateTime.parse(v).toInstant(),
            v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
            v -> LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant(),
            v -> Instant.ofEpochMilli(Long.parseLong(v))
    );

    private final SyncStateService syncState;
    private final SectionStores stores;
    private final ObjectMapper om;
    private final Clock clock;

    public SyncReadResponse read(Long userId, String lastSyncedAtRaw) {
        // ✅ 先取時間再讀紀錄：client 拿它當下次 watermark 時，不會漏掉讀取期間提交的寫入
        String serverTimestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS).toString();

        Optional<UserSyncStateEntity> found = syncState.find(userId);
        if (found.isEmpty()) {
            ObjectNode data = om.createObjectNode();
            for (SyncSection s : SyncSection.normalized()) {
                if (s == SyncSection.COOKWARE) continue;
                data.set(s.wireName(), om.createArrayNode());
            }
            data.set(SyncSection.COOKWARE.wireName(), stores.cookware().readAll(userId));
            return SyncReadResponse.full(data, serverTimestamp, null);
        }

        UserSyncStateEntity state = found.get();
        String lastSyncedAt = state.getLastSyncedAt() == null ? null : state.getLastSyncedAt().toString();
        Instant watermark = parseWatermark(userId, lastSyncedAtRaw);

        if (watermark == null) {
            ObjectNode data = om.createObjectNode();
            for (SyncSection s : SyncSection.values()) {
                data.set(s.wireName(), readSection(userId, state, s));
            }
            return SyncReadResponse.full(data, serverTimestamp, lastSyncedAt);
        }

        if (state.getUpdatedAt() != null && !state.getUpdatedAt().isAfter(watermark)) {
            return SyncReadResponse.unchanged(serverTimestamp, lastSyncedAt);
        }

        ObjectNode data = om.createObjectNode();
        int included = 0;
        for (SyncSection s : SyncSection.values()) {
            if (s == SyncSection.COOKWARE) {
                data.set(s.wireName(), readSection(userId, state, s));
                continue;
            }
            Instant at = state.sectionUpdatedAt(s);
            if (at != null && at.isAfter(watermark)) {
                data.set(s.wireName(), readSection(userId, state, s));
                included++;
            }
        }
        log.debug("sync_delta userId={} watermark={} sections={}", userId, watermark, included);
        return SyncReadResponse.delta(data, serverTimestamp, lastSyncedAt);
    }

    private JsonNode readSection(Long userId, UserSyncStateEntity state, SyncSection s) {
        if (s.isNormalized()) return stores.get(s).readAll(userId);
        JsonNode v = state.blob(s);
        return v == null ? om.nullNode() : v;
    }

    /**
     * null = 沒帶或無法解析（走完整回應）。
     * 依序試：帶 offset 的 ISO 時間、不帶 offset 的 ISO 時間（視為 UTC）、純日期（UTC 零點）、epoch 毫秒。
     */
    Instant parseWatermark(Long userId, String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim();

        RuntimeException last = null;
        for (Function<String, Instant> format : WATERMARK_FORMATS) {
            try {
                return format.apply(v);
            } catch (DateTimeException | NumberFormatException e) {
                last = e;
            }
        }
        log.warn("sync_watermark_unparseable userId={} lastSyncedAt={} error={} -> full response",
                userId, v, last.getMessage());
        return null;
    }
}
