package com.kitchensync.backend.sync.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** 組 item JSON 時略過 null 欄位 */
public final class ItemJsonWriter {

    private final ObjectNode out;

    ItemJsonWriter(ObjectNode out) {
        this.out = out;
    }

    public ItemJsonWriter text(String key, String v) {
        if (v != null) out.put(key, v);
        return this;
    }

    /** 整數值寫成整數，避免 2 讀回來變 2.0 */
    public ItemJsonWriter number(String key, Double v) {
        if (v == null) return this;
        if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) {
            return longInteger(key, v.longValue());
        }
        out.put(key, v);
        return this;
    }

    public ItemJsonWriter integer(String key, Integer v) {
        if (v != null) out.put(key, v);
        return this;
    }

    /** 落在 int 範圍內就寫 int，跟 client 原本送的數字型別一致 */
    public ItemJsonWriter longInteger(String key, Long v) {
        if (v == null) return this;
        if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) {
            out.put(key, v.intValue());
        } else {
            out.put(key, v);
        }
        return this;
    }

    public ItemJsonWriter bool(String key, Boolean v) {
        if (v != null) out.put(key, v);
        return this;
    }

    public ItemJsonWriter json(String key, JsonNode v) {
        if (v != null && !v.isNull()) out.set(key, v.deepCopy());
        return this;
    }
}
