package com.sentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four independent axes along which a change radius is scored.
 */
public enum RadiusAxis {
    FILES("files"),
    LINES("lines"),
    INTERFACE("interface"),
    CROSS_WAVE("cross_wave");

    private final String label;

    RadiusAxis(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
