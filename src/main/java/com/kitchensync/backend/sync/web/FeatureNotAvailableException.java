package com.kitchensync.backend.sync.web;

public class FeatureNotAvailableException extends RuntimeException {
    private final String feature;

    public FeatureNotAvailableException(String feature) {
        super("FEATURE_NOT_AVAILABLE");
        this.feature = feature;
    }

    public String feature() { return feature; }
}
