package com.kitchensync.backend.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * blob 合併規則：guest merge 用 appendById / firstWriteWins，備份匯入（merge 模式）用 upsertById / deepMerge。
 */
final class BlobMerge {

    private BlobMerge() {}

    /**
     * 陣列 blob：incoming 中 id 尚未出現的 entry 接在後面；
     * 沒有 id 的 entry 只有在沒有完全相同的 entry 時才接上。
     * 既有值不是陣列時保留既有值。
     */
    static JsonNode appendById(JsonNode existing, JsonNode incoming) {
        if (incoming == null || !incoming.isArray()) return existing;
        if (existing == null || existing.isNull()) return incoming.deepCopy();
        if (!existing.isArray()) return existing;

        ArrayNode out = ((ArrayNode) existing).deepCopy();
        Set<String> seenIds = new HashSet<>();
        for (JsonNode e : out) {
            String id = idOf(e);
            if (id != null) seenIds.add(id);
        }

        for (JsonNode e : incoming) {
            String id = idOf(e);
            if (id != null) {
                if (seenIds.add(id)) out.add(e.deepCopy());
            } else if (!contains(out, e)) {
                out.add(e.deepCopy());
            }
        }
        return out;
    }

    /**
     * 陣列 blob 匯入：同 id 的 entry 原地換成 incoming 版本，新 id 接在後面；
     * 沒有 id 的 entry 跟 appendById 一樣去重後接上。既有值不是陣列時整個換成 incoming。
     */
    static JsonNode upsertById(JsonNode existing, JsonNode incoming) {
        if (incoming == null || !incoming.isArray()) return existing;
        if (existing == null || !existing.isArray()) return incoming.deepCopy();

        ArrayNode out = ((ArrayNode) existing).deepCopy();
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < out.size(); i++) {
            String id = idOf(out.get(i));
            if (id != null) indexById.putIfAbsent(id, i);
        }

        for (JsonNode e : incoming) {
            String id = idOf(e);
            if (id == null) {
                if (!contains(out, e)) out.add(e.deepCopy());
                continue;
            }
            Integer at = indexById.get(id);
            if (at != null) {
                out.set(at, e.deepCopy());
            } else {
                indexById.put(id, out.size());
                out.add(e.deepCopy());
            }
        }
        return out;
    }

    /**
     * 物件遞迴合併：兩邊都是物件的 key 往下合併，其餘以 incoming 為準。
     * 任一邊不是物件時直接用 incoming。
     */
    static JsonNode deepMerge(JsonNode existing, JsonNode incoming) {
        if (incoming == null || incoming.isNull()) return existing;
        if (existing == null || !existing.isObject() || !incoming.isObject()) return incoming.deepCopy();

        ObjectNode out = ((ObjectNode) existing).deepCopy();
        incoming.fields().forEachRemaining(f -> {
            JsonNode cur = out.get(f.getKey());
            if (cur != null && cur.isObject() && f.getValue().isObject()) {
                out.set(f.getKey(), deepMerge(cur, f.getValue()));
            } else {
                out.set(f.getKey(), f.getValue().deepCopy());
            }
        });
        return out;
    }

    /** 先寫先贏：既有值存在就不動 */
    static JsonNode firstWriteWins(JsonNode existing, JsonNode incoming) {
        if (existing != null && !existing.isNull()) return existing;
        return (incoming == null || incoming.isNull()) ? existing : incoming.deepCopy();
    }

    private static String idOf(JsonNode e) {
        if (e == null || !e.isObject()) return null;
        JsonNode id = e.get("id");
        if (id == null || id.isNull() || id.isContainerNode()) return null;
        return id.asText();
    }

    private static boolean contains(ArrayNode arr, JsonNode e) {
        for (JsonNode x : arr) {
            if (x.equals(e)) return true;
        }
        return false;
    }
}
