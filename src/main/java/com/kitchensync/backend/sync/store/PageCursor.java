package com.kitchensync.backend.sync.store;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * 分頁游標：最後一筆的 (updatedAtUtc, row id)，base64url 編碼後交給 client。
 * 排序固定為 updatedAtUtc 升冪、row id 升冪。
 */
public record PageCursor(Instant updatedAt, String rowId) {

    private static final char SEP = '|';

    public String encode() {
        String raw = updatedAt.toString() + SEP + rowId;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /** 格式不對回 null */
    public static PageCursor decodeOrNull(String cursor) {
        if (cursor == null || cursor.isBlank()) return null;
        String raw;
        try {
            raw = new String(Base64.getUrlDecoder().decode(cursor.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return null;
        }

        int i = raw.indexOf(SEP);
        if (i <= 0 || i == raw.length() - 1) return null;
        try {
            return new PageCursor(Instant.parse(raw.substring(0, i)), raw.substring(i + 1));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
