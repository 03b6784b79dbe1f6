package com.sentinel.core.model;

/**
 * How a change-radius violation propagates to downstream work.
 */
public enum CascadeMode {
    AUTO,
    HUMAN_GATED;

    /**
     * Parses {@code auto} / {@code human-gated} (case-insensitive, '-' or '_').
     */
    public static CascadeMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        return valueOf(raw.trim().toUpperCase().replace('-', '_'));
    }
}
