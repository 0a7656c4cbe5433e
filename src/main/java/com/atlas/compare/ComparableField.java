package com.atlas.compare;

import com.atlas.domain.DetectionRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Fields shown in a side-by-side diff, in display order.
 *
 * Each field maps a record to a canonical value: set fields become a sorted
 * list so that two records listing the same values in a different order
 * compare equal, and absent text becomes the empty string. Title and source
 * identify the panels and are never flagged.
 */
public enum ComparableField {
    TITLE("title", false, DetectionRecord::getTitle),
    SOURCE("source", false, record -> record.getSource().getValue()),
    SEVERITY("severity", true, record -> record.getSeverity().getValue()),
    STATUS("status", true, record -> record.getStatus().getValue()),
    LANGUAGE("language", true, DetectionRecord::getLanguage),
    PLATFORM("platform", true, DetectionRecord::getPlatform),
    EVENT_CATEGORY("event_category", true, DetectionRecord::getEventCategory),
    DATA_SOURCE_NORMALIZED("data_source_normalized", true, DetectionRecord::getDataSourceNormalized),
    MITRE_TACTICS("mitre_tactics", true, record -> sorted(record.getMitreTactics())),
    MITRE_TECHNIQUES("mitre_techniques", true, record -> sorted(record.getMitreTechniques())),
    LOG_SOURCES("log_sources", true, record -> sorted(record.getLogSources())),
    DESCRIPTION("description", true, DetectionRecord::getDescription),
    DETECTION_LOGIC("detection_logic", true, DetectionRecord::getDetectionLogic);

    private final String field;
    private final boolean flaggable;
    private final Function<DetectionRecord, Object> extractor;

    ComparableField(String field, boolean flaggable, Function<DetectionRecord, Object> extractor) {
        this.field = field;
        this.flaggable = flaggable;
        this.extractor = extractor;
    }

    public String getField() {
        return field;
    }

    public boolean isFlaggable() {
        return flaggable;
    }

    public Object valueOf(DetectionRecord record) {
        Object value = extractor.apply(record);
        return value != null ? value : "";
    }

    private static List<String> sorted(Collection<String> values) {
        List<String> list = new ArrayList<>(values);
        Collections.sort(list);
        return list;
    }
}
