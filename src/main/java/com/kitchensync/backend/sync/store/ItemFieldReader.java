package com.kitchensync.backend.sync.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 從一個 client item 讀已知欄位。
 *
 * <p>只有能原樣寫回去的值才放進欄位；型別不符或明確的 null 會原封不動放進 extra，
 * 讀取時再併回 item，所以 client 送什麼就拿回什麼。</p>
 */
public final class ItemFieldReader {

    /** number 欄位寫回時會轉成整數的上限，超過就保留原始值 */
    private static final double EXACT_INTEGRAL_LIMIT = 1e15;

    private final ObjectNode item;
    private final ObjectNode extra;

    ItemFieldReader(ObjectNode item, ObjectNode extra) {
        this.item = item;
        this.extra = extra;
    }

    /** 沒有這個 key 回 null；明確的 null 記進 extra 後也回 null */
    private JsonNode present(String key) {
        JsonNode v = item.get(key);
        if (v == null) return null;
        if (v.isNull()) {
            extra.set(key, v);
            return null;
        }
        return v;
    }

    private <T> T keepRaw(String key, JsonNode v) {
        extra.set(key, v.deepCopy());
        return null;
    }

    public String text(String key) {
        JsonNode v = present(key);
        if (v == null) return null;
        return v.isTextual() ? v.asText() : keepRaw(key, v);
    }

    /**
     * 整數或非整數值的小數才收；像 2.0 這種寫回會變成 2 的值保留原始 JSON。
     */
    public Double number(String key) {
        JsonNode v = present(key);
        if (v == null) return null;
        if (v.isIntegralNumber() && v.canConvertToLong() && Math.abs(v.doubleValue()) < EXACT_INTEGRAL_LIMIT) {
            return v.doubleValue();
        }
        if (v.isFloatingPointNumber() && v.isDouble()) {
            double d = v.doubleValue();
            if (Double.isFinite(d) && d != Math.rint(d)) return d;
        }
        return keepRaw(key, v);
    }

    public Integer integer(String key) {
        JsonNode v = present(key);
        if (v == null) return null;
        return (v.isInt()) ? Integer.valueOf(v.intValue()) : keepRaw(key, v);
    }

    public Long longInteger(String key) {
        JsonNode v = present(key);
        if (v == null) return null;
        return (v.isInt() || v.isLong()) ? Long.valueOf(v.longValue()) : keepRaw(key, v);
    }

    public Boolean bool(String key) {
        JsonNode v = present(key);
        if (v == null) return null;
        return v.isBoolean() ? Boolean.valueOf(v.booleanValue()) : keepRaw(key, v);
    }

    /** 物件或陣列原樣保存 */
    public JsonNode structure(String key) {
        JsonNode v = present(key);
        if (v == null) return null;
        return v.isContainerNode() ? v.deepCopy() : keepRaw(key, v);
    }

    /** 任何非 null 的 JSON 值 */
    public JsonNode any(String key) {
        JsonNode v = present(key);
        return (v == null) ? null : v.deepCopy();
    }
}
