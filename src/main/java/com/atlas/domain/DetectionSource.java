package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enumeration of the detection-content repositories records are ingested from.
 * New vendors are added as new constants; values the ingestion side emits that
 * this build does not know yet map to {@link #OTHER}.
 */
public enum DetectionSource {

    SIGMA("sigma"),
    ELASTIC("elastic"),
    ELASTIC_PROTECTIONS("elastic_protections"),
    ELASTIC_HUNTING("elastic_hunting"),
    SPLUNK("splunk"),
    SUBLIME("sublime"),
    SENTINEL("sentinel"),
    LOLRMM("lolrmm"),
    OTHER("other");

    private final String value;

    DetectionSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DetectionSource fromValue(String value) {
        if (value == null) {
            return OTHER;
        }
        for (DetectionSource source : DetectionSource.values()) {
            if (source.value.equalsIgnoreCase(value.trim())) {
                return source;
            }
        }
        return OTHER;
    }

    /**
     * Strict variant used for request parameters, where an unknown source name
     * is a caller error rather than a data-quality issue.
     *
     * @throws IllegalArgumentException if the value names no known source
     */
    public static DetectionSource parse(String value) {
        DetectionSource source = fromValue(value);
        if (source == OTHER && !"other".equalsIgnoreCase(value == null ? "" : value.trim())) {
            throw new IllegalArgumentException("Unknown DetectionSource value: " + value);
        }
        return source;
    }
}
