package com.kitchensync.backend.sync.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kitchensync.backend.sync.entity.SyncItemEntity;
import com.kitchensync.backend.sync.model.SyncSection;
import com.kitchensync.backend.sync.repo.SyncItemRepository;
import com.kitchensync.backend.sync.web.SyncValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 一種正規化 item 的儲存。
 *
 * <p>子類只描述「哪些欄位是已知欄位、怎麼對到 entity」；
 * 驗證、extension map、整批取代與逐筆 upsert 都在這裡處理。</p>
 *
 * <p>每個寫入方法各自是一個 transaction：整批取代要嘛全部生效，要嘛完全沒動。</p>
 *
 * <p>PreparedSection 內的 entity 只能寫入一次，寫入後就成為 JPA 管理的物件。</p>
 */
@Slf4j
public abstract class AbstractSectionStore<E extends SyncItemEntity> {

    public static final String ID_KEY = "id";
    public static final String UPDATED_AT_KEY = "updatedAt";

    protected final SyncItemRepository<E> repo;
    protected final ObjectMapper om;

    protected AbstractSectionStore(SyncItemRepository<E> repo, ObjectMapper om) {
        this.repo = repo;
        this.om = om;
    }

    public abstract SyncSection section();

    protected abstract E newEntity();

    /** 已知欄位（含 id）；其餘欄位進 extra_data */
    protected abstract Set<String> knownKeys();

    protected abstract void readKnownFields(ItemFieldReader in, E entity);

    protected abstract void writeKnownFields(E entity, ItemJsonWriter out);

    // ===== 驗證 =====

    /**
     * 驗證並轉成尚未寫入的 entity。
     * null 視為空陣列；同一個 id 出現多次時保留最後一筆（位置也跟著最後一筆）。
     * 已知欄位型別不符不算錯，原始值放進 extra_data。
     *
     * @throws SyncValidationException 不是陣列、item 不是物件、或缺 id
     */
    public PreparedSection<E> prepare(JsonNode items) {
        if (items == null || items.isNull()) return new PreparedSection<>(section(), new ArrayList<>());
        if (!items.isArray()) {
            throw new SyncValidationException(section().wireName(), List.of("expected array"));
        }

        List<String> errors = new ArrayList<>();
        LinkedHashMap<String, E> byId = new LinkedHashMap<>();

        for (int i = 0; i < items.size(); i++) {
            JsonNode raw = items.get(i);
            if (!(raw instanceof ObjectNode obj)) {
                errors.add("[" + i + "]: expected object");
                continue;
            }
            String itemId = readItemId(obj.get(ID_KEY));
            if (itemId == null) {
                errors.add("[" + i + "].id: required string or number");
                continue;
            }

            E entity = toEntity(obj, itemId);
            byId.remove(itemId);
            byId.put(itemId, entity);
        }

        if (!errors.isEmpty()) {
            throw new SyncValidationException(section().wireName(), errors);
        }
        return new PreparedSection<>(section(), new ArrayList<>(byId.values()));
    }

    /** 單筆版本，給 item-level API 用 */
    public PreparedSection<E> prepareOne(JsonNode item) {
        ArrayNode arr = om.createArrayNode();
        arr.add(item == null ? om.nullNode() : item);
        return prepare(arr);
    }

    static String readItemId(JsonNode id) {
        if (id == null || id.isNull()) return null;
        if (id.isTextual()) {
            String s = id.asText();
            return s.isBlank() ? null : s;
        }
        if (id.isIntegralNumber()) return id.bigIntegerValue().toString();
        if (id.isNumber()) return id.decimalValue().stripTrailingZeros().toPlainString();
        return null;
    }

    private E toEntity(ObjectNode obj, String itemId) {
        E entity = newEntity();
        entity.setItemId(itemId);

        ObjectNode extra = om.createObjectNode();
        // 數字 id 以字串比對，原始 JSON 型別留在 extra，讀回時還原
        JsonNode rawId = obj.get(ID_KEY);
        if (!rawId.isTextual()) extra.set(ID_KEY, rawId.deepCopy());

        readKnownFields(new ItemFieldReader(obj, extra), entity);

        Set<String> known = knownKeys();
        obj.fields().forEachRemaining(f -> {
            if (!known.contains(f.getKey())) extra.set(f.getKey(), f.getValue().deepCopy());
        });
        entity.setExtraData(extra.isEmpty() ? null : extra);
        return entity;
    }

    // ===== 寫入 =====

    /**
     * 整批取代：刪掉該使用者此 section 的全部 item，再依順序寫入。
     * 空的 prepared 等於清空。
     */
    @Transactional
    public int replaceAll(Long userId, PreparedSection<?> prepared, Instant stamp) {
        PreparedSection<E> own = cast(prepared);
        int deleted = repo.deleteAllForUser(userId);

        List<E> rows = own.items();
        int order = 0;
        for (E row : rows) {
            row.setUserId(userId);
            row.setSortOrder(order++);
            row.setUpdatedAtUtc(stamp);
        }
        repo.saveAll(rows);

        log.debug("section_replace userId={} section={} deleted={} inserted={}",
                userId, section().wireName(), deleted, rows.size());
        return rows.size();
    }

    /**
     * 逐筆 upsert：同 id 覆寫欄位，新 id 接在最後；payload 沒提到的 item 不動。
     */
    @Transactional
    public UpsertCounts upsertAll(Long userId, PreparedSection<?> prepared, Instant stamp) {
        PreparedSection<E> own = cast(prepared);
        if (own.isEmpty()) return new UpsertCounts(0, 0);

        Map<String, E> existing = repo.findByUserIdAndItemIdIn(userId, own.itemIds()).stream()
                .collect(Collectors.toMap(SyncItemEntity::getItemId, e -> e, (a, b) -> a, HashMap::new));

        int nextOrder = repo.maxSortOrder(userId) + 1;
        int inserted = 0;
        int updated = 0;
        List<E> rows = own.items();

        for (E row : rows) {
            row.setUserId(userId);
            row.setUpdatedAtUtc(stamp);

            E current = existing.get(row.getItemId());
            if (current != null) {
                row.setId(current.getId());
                row.setSortOrder(current.getSortOrder());
                row.setCreatedAtUtc(current.getCreatedAtUtc());
                updated++;
            } else {
                row.setSortOrder(nextOrder++);
                inserted++;
            }
        }
        repo.saveAll(rows);

        log.debug("section_upsert userId={} section={} inserted={} updated={}",
                userId, section().wireName(), inserted, updated);
        return new UpsertCounts(inserted, updated);
    }

    /**
     * 單筆 upsert，帶過期判斷：既有資料比 incomingAt 新就不寫，回傳伺服器版本。
     */
    @Transactional
    public UpsertOutcome upsertOne(Long userId, PreparedSection<?> prepared, Instant incomingAt, Instant stamp) {
        PreparedSection<E> own = cast(prepared);
        if (own.size() != 1) throw new IllegalArgumentException("ITEM_ID_REQUIRED");

        E incoming = own.items().get(0);
        var current = repo.findByUserIdAndItemId(userId, incoming.getItemId());

        if (current.isPresent()) {
            E cur = current.get();
            if (cur.getUpdatedAtUtc() != null && incomingAt.isBefore(cur.getUpdatedAtUtc())) {
                return UpsertOutcome.skipped(incoming.getItemId(), toJson(cur));
            }
        }

        E row = incoming;
        row.setUserId(userId);
        row.setUpdatedAtUtc(stamp);
        if (current.isPresent()) {
            row.setId(current.get().getId());
            row.setSortOrder(current.get().getSortOrder());
            row.setCreatedAtUtc(current.get().getCreatedAtUtc());
        } else {
            row.setSortOrder(repo.maxSortOrder(userId) + 1);
        }
        repo.save(row);

        return current.isPresent()
                ? UpsertOutcome.updated(incoming.getItemId())
                : UpsertOutcome.created(incoming.getItemId());
    }

    /**
     * 匯入用的合併：新 id 接在最後；既有 item 只有在 incomingAt 比伺服器版本新時才覆寫。
     * incomingAt 回 null 視為最舊（不會蓋掉既有資料）。
     */
    @Transactional
    public MergeCounts upsertIfNewer(Long userId, PreparedSection<?> prepared,
                                     Function<SyncItemEntity, Instant> incomingAt, Instant stamp) {
        PreparedSection<E> own = cast(prepared);
        if (own.isEmpty()) return new MergeCounts(0, 0, 0);

        Map<String, E> existing = repo.findByUserIdAndItemIdIn(userId, own.itemIds()).stream()
                .collect(Collectors.toMap(SyncItemEntity::getItemId, e -> e, (a, b) -> a, HashMap::new));

        int nextOrder = repo.maxSortOrder(userId) + 1;
        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        List<E> rows = new ArrayList<>();

        for (E row : own.items()) {
            E current = existing.get(row.getItemId());
            if (current != null) {
                Instant at = incomingAt.apply(row);
                if (current.getUpdatedAtUtc() != null && (at == null || !current.getUpdatedAtUtc().isBefore(at))) {
                    skipped++;
                    continue;
                }
                row.setId(current.getId());
                row.setSortOrder(current.getSortOrder());
                row.setCreatedAtUtc(current.getCreatedAtUtc());
                updated++;
            } else {
                row.setSortOrder(nextOrder++);
                inserted++;
            }
            row.setUserId(userId);
            row.setUpdatedAtUtc(stamp);
            rows.add(row);
        }
        repo.saveAll(rows);

        log.debug("section_merge userId={} section={} inserted={} updated={} skipped={}",
                userId, section().wireName(), inserted, updated, skipped);
        return new MergeCounts(inserted, updated, skipped);
    }

    @Transactional
    public boolean deleteOne(Long userId, String itemId) {
        return repo.deleteOne(userId, itemId) > 0;
    }

    // ===== 讀取 =====

    @Transactional(readOnly = true)
    public ArrayNode readAll(Long userId) {
        ArrayNode out = om.createArrayNode();
        for (E e : repo.findByUserIdOrderBySortOrderAsc(userId)) {
            out.add(toJson(e));
        }
        return out;
    }

    /**
     * 游標分頁，依 updatedAtUtc、row id 升冪。
     * 多拿一筆判斷有沒有下一頁。
     */
    @Transactional(readOnly = true)
    public ItemPage page(Long userId, int limit, PageCursor after) {
        Pageable window = PageRequest.of(0, limit + 1);
        List<E> rows = (after == null)
                ? pageFirst(userId, window)
                : pageAfter(userId, after, window);

        boolean hasMore = rows.size() > limit;
        List<E> visible = hasMore ? rows.subList(0, limit) : rows;

        ArrayNode items = om.createArrayNode();
        for (E e : visible) items.add(toJson(e));

        PageCursor next = null;
        if (hasMore && !visible.isEmpty()) {
            E last = visible.get(visible.size() - 1);
            next = new PageCursor(last.getUpdatedAtUtc(), last.getId());
        }
        return new ItemPage(items, next);
    }

    /** 備份用：陣列順序照 sortOrder，item 沒帶 updatedAt 時補上伺服器寫入時間 */
    @Transactional(readOnly = true)
    public ArrayNode exportAll(Long userId) {
        ArrayNode out = om.createArrayNode();
        for (E e : liveRows(userId)) {
            ObjectNode item = toJson(e);
            if (!item.has(UPDATED_AT_KEY) && e.getUpdatedAtUtc() != null) {
                item.put(UPDATED_AT_KEY, e.getUpdatedAtUtc().toString());
            }
            out.add(item);
        }
        return out;
    }

    @Transactional(readOnly = true)
    public long count(Long userId) {
        return repo.countByUserId(userId);
    }

    @Transactional(readOnly = true)
    public Set<String> existingItemIds(Long userId, Set<String> candidates) {
        if (candidates.isEmpty()) return Set.of();
        return repo.findByUserIdAndItemIdIn(userId, candidates).stream()
                .map(SyncItemEntity::getItemId)
                .collect(Collectors.toSet());
    }

    @Transactional(readOnly = true)
    public boolean exists(Long userId, String itemId) {
        return repo.findByUserIdAndItemId(userId, itemId).isPresent();
    }

    // 子類可以縮小分頁與匯出的範圍（例如排除軟刪除）

    protected List<E> liveRows(Long userId) {
        return repo.findByUserIdOrderBySortOrderAsc(userId);
    }

    protected List<E> pageFirst(Long userId, Pageable window) {
        return repo.pageFirst(userId, window);
    }

    protected List<E> pageAfter(Long userId, PageCursor after, Pageable window) {
        return repo.pageAfter(userId, after.updatedAt(), after.rowId(), window);
    }

    /**
     * id + 已知欄位 + extra_data。
     * extra_data 裡的已知 key 只會是原始 id 或型別不符的原始值，那時欄位本身是 null，所以直接蓋上去。
     */
    protected ObjectNode toJson(E e) {
        ObjectNode out = om.createObjectNode();
        out.put(ID_KEY, e.getItemId());
        writeKnownFields(e, new ItemJsonWriter(out));

        JsonNode extra = e.getExtraData();
        if (extra instanceof ObjectNode ext) {
            ext.fields().forEachRemaining(f -> out.set(f.getKey(), f.getValue().deepCopy()));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private PreparedSection<E> cast(PreparedSection<?> prepared) {
        if (prepared.section() != section()) {
            throw new IllegalStateException("section mismatch: " + prepared.section() + " vs " + section());
        }
        return (PreparedSection<E>) prepared;
    }

    public record UpsertCounts(int inserted, int updated) {}

    public record MergeCounts(int inserted, int updated, int skipped) {}

    public record ItemPage(ArrayNode items, PageCursor next) {}

    public record UpsertOutcome(String operation, String itemId, ObjectNode serverVersion) {
        public static final String CREATED = "created";
        public static final String UPDATED = "updated";
        public static final String SKIPPED = "skipped";

        static UpsertOutcome created(String itemId) { return new UpsertOutcome(CREATED, itemId, null); }
        static UpsertOutcome updated(String itemId) { return new UpsertOutcome(UPDATED, itemId, null); }
        static UpsertOutcome skipped(String itemId, ObjectNode server) { return new UpsertOutcome(SKIPPED, itemId, server); }

        public boolean isSkipped() {
            return SKIPPED.equals(operation);
        }
    }
}
