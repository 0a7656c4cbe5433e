package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * One row of a side-by-side diff: the values of a field across the selected
 * records, in selection order, and whether they disagree.
 */
public class FieldComparison {

    @JsonProperty("field")
    private final String field;

    @JsonProperty("values")
    private final List<Object> values;

    @JsonProperty("differs")
    private final boolean differs;

    public FieldComparison(String field, List<Object> values, boolean differs) {
        this.field = field;
        this.values = Collections.unmodifiableList(values);
        this.differs = differs;
    }

    public String getField() {
        return field;
    }

    public List<Object> getValues() {
        return values;
    }

    public boolean isDiffers() {
        return differs;
    }
}
