package com.kitchensync.backend.sync.web;

public class CookwareLimitExceededException extends RuntimeException {
    private final int limit;
    private final int count;

    public CookwareLimitExceededException(int limit, int count) {
        super("COOKWARE_LIMIT_REACHED");
        this.limit = limit;
        this.count = count;
    }

    public int limit() { return limit; }
    public int count() { return count; }
}
