package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity assigned to a detection rule by its vendor.
 * Declared from most to least severe; {@link #getRank()} is the sort key.
 */
public enum Severity {

    CRITICAL("critical", 4),
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1),
    UNKNOWN("unknown", 0);

    private final String value;
    private final int rank;

    Severity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Parse a string value to Severity. Vendor aliases such as "informational"
     * and unrecognised values map to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (Severity severity : Severity.values()) {
            if (severity.value.equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        return UNKNOWN;
    }
}
