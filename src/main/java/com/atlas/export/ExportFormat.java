package com.atlas.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Output formats of the export pipeline.
 */
public enum ExportFormat {
    JSON("json", "application/json"),
    CSV("csv", "text/csv");

    private final String value;
    private final String contentType;

    ExportFormat(String value, String contentType) {
        this.value = value;
        this.contentType = contentType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getContentType() {
        return contentType;
    }

    public String getFileName() {
        return "detections_export." + value;
    }

    /**
     * @throws IllegalArgumentException if the value names no format
     */
    @JsonCreator
    public static ExportFormat fromValue(String value) {
        for (ExportFormat format : ExportFormat.values()) {
            if (format.value.equalsIgnoreCase(value == null ? "" : value.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown ExportFormat value: " + value);
    }
}
