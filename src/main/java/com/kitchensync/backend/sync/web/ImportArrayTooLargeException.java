package com.kitchensync.backend.sync.web;

import java.util.List;

public class ImportArrayTooLargeException extends RuntimeException {
    private final int limit;
    private final List<Violation> violations;

    public ImportArrayTooLargeException(int limit, List<Violation> violations) {
        super("IMPORT_ARRAY_TOO_LARGE");
        this.limit = limit;
        this.violations = List.copyOf(violations);
    }

    public int limit() { return limit; }
    public List<Violation> violations() { return violations; }

    public record Violation(String section, int count) {}
}
