package com.trendradar.radar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReportMode {
    DAILY("daily"),
    CURRENT("current"),
    INCREMENTAL("incremental");

    private final String code;

    ReportMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Parses a mode code case-insensitively; returns null for blank input.
     *
     * @throws IllegalArgumentException when the code names no mode
     */
    @JsonCreator
    public static ReportMode fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ReportMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown report mode: " + code);
    }
}
