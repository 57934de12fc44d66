package com.zero.core.model;

/**
 * Staleness classification of an artifact relative to its TTL.
 */
public enum FreshnessLevel {
    FRESH,
    STALE,
    VERY_STALE,
    EXPIRED;

    public boolean needsRefresh() {
        return this != FRESH;
    }

    public String label() {
        return switch (this) {
            case FRESH -> "Fresh";
            case STALE -> "Stale";
            case VERY_STALE -> "Very Stale";
            case EXPIRED -> "Expired";
        };
    }
}
