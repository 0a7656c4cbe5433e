package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Side-by-side comparison of a record selection.
 */
public class DiffResult {

    @JsonProperty("detections")
    private final List<DetectionRecord> detections;

    @JsonProperty("field_comparison")
    private final List<FieldComparison> fieldComparison;

    public DiffResult(List<DetectionRecord> detections, List<FieldComparison> fieldComparison) {
        this.detections = Collections.unmodifiableList(detections);
        this.fieldComparison = Collections.unmodifiableList(fieldComparison);
    }

    public List<DetectionRecord> getDetections() {
        return detections;
    }

    public List<FieldComparison> getFieldComparison() {
        return fieldComparison;
    }

    public FieldComparison getField(String field) {
        for (FieldComparison comparison : fieldComparison) {
            if (comparison.getField().equals(field)) {
                return comparison;
            }
        }
        return null;
    }

    @JsonProperty("differing_fields")
    public List<String> getDifferingFields() {
        List<String> differing = new ArrayList<>();
        for (FieldComparison comparison : fieldComparison) {
            if (comparison.isDiffers()) {
                differing.add(comparison.getField());
            }
        }
        return differing;
    }
}
