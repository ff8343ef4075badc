package com.kitchensync.backend.sync.web;

import java.util.List;

/** item 陣列格式錯誤；在任何寫入之前丟出 */
public class SyncValidationException extends RuntimeException {
    private final String section;
    private final List<String> errors;

    public SyncValidationException(String section, List<String> errors) {
        super("SYNC_VALIDATION_FAILED");
        this.section = section;
        this.errors = List.copyOf(errors);
    }

    public String section() { return section; }
    public List<String> errors() { return errors; }
}
