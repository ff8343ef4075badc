package com.kitchensync.backend.sync.web;

import java.util.List;

/** 備份內容有不合法的 item；什麼都還沒寫 */
public class ImportValidationException extends RuntimeException {
    private final List<String> errors;

    public ImportValidationException(List<String> errors) {
        super("IMPORT_VALIDATION_FAILED");
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() { return errors; }
}
