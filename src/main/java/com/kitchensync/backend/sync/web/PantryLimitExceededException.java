package com.kitchensync.backend.sync.web;

public class PantryLimitExceededException extends RuntimeException {
    private final int limit;

    public PantryLimitExceededException(int limit) {
        super("PANTRY_LIMIT_REACHED");
        this.limit = limit;
    }

    public int limit() { return limit; }
}
