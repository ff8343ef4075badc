package com.kitchensync.backend.sync.store;

import com.kitchensync.backend.sync.entity.SyncItemEntity;
import com.kitchensync.backend.sync.model.SyncSection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 已驗證、尚未寫入的一個 section。
 * entity 還沒有 userId / sortOrder，寫入時由 store 補上。
 */
public final class PreparedSection<E extends SyncItemEntity> {

    private final SyncSection section;
    private final List<E> items;

    PreparedSection(SyncSection section, List<E> items) {
        this.section = section;
        this.items = Collections.unmodifiableList(items);
    }

    public SyncSection section() {
        return section;
    }

    public List<E> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Set<String> itemIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (E e : items) ids.add(e.getItemId());
        return ids;
    }

    /**
     * 已存在的 item 一律保留；新的 item 依原順序最多保留 slots 筆。
     */
    public PreparedSection<E> limitNewItems(Set<String> existingIds, int slots) {
        List<E> kept = new ArrayList<>();
        int remaining = Math.max(0, slots);
        for (E e : items) {
            if (existingIds.contains(e.getItemId())) {
                kept.add(e);
            } else if (remaining > 0) {
                kept.add(e);
                remaining--;
            }
        }
        return new PreparedSection<>(section, kept);
    }
}
