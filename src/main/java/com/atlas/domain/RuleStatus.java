package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Maturity status of a detection rule as published by its source repository.
 */
public enum RuleStatus {

    STABLE("stable"),
    EXPERIMENTAL("experimental"),
    DEPRECATED("deprecated"),
    UNKNOWN("unknown");

    private final String value;

    RuleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a string value to RuleStatus, falling back to {@link #UNKNOWN}.
     */
    @JsonCreator
    public static RuleStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (RuleStatus status : RuleStatus.values()) {
            if (status.value.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
