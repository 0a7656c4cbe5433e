package com.atlas.search;

import com.atlas.domain.DetectionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds record comparators for the supported sort fields.
 *
 * Null values sort last in both directions and ties are broken by record id,
 * so paging through a sorted result is stable. An unsupported field is not an
 * error: the caller gets title ascending and a WARN line.
 */
public final class RecordSorter {

    private static final Logger log = LoggerFactory.getLogger(RecordSorter.class);

    /**
     * Supported sort fields and their keys.
     */
    public enum SortField {
        TITLE("title", DetectionRecord::getTitle, String.CASE_INSENSITIVE_ORDER),
        SEVERITY("severity", r -> r.getSeverity().getRank(), Comparator.<Integer>naturalOrder()),
        SOURCE("source", r -> r.getSource().getValue(), Comparator.<String>naturalOrder()),
        RULE_CREATED_DATE("rule_created_date", DetectionRecord::getRuleCreatedDate, Comparator.<Instant>naturalOrder()),
        RULE_MODIFIED_DATE("rule_modified_date", DetectionRecord::getRuleModifiedDate, Comparator.<Instant>naturalOrder()),
        STATUS("status", r -> r.getStatus().getValue(), Comparator.<String>naturalOrder());

        private final String field;
        private final Comparator<DetectionRecord> ascending;
        private final Comparator<DetectionRecord> descending;

        <T> SortField(String field, Function<DetectionRecord, T> key, Comparator<T> order) {
            this.field = field;
            this.ascending = Comparator.comparing(key, Comparator.nullsLast(order));
            this.descending = Comparator.comparing(key, Comparator.nullsLast(order.reversed()));
        }

        public String getField() {
            return field;
        }

        public static Optional<SortField> fromField(String field) {
            if (field == null) {
                return Optional.empty();
            }
            for (SortField sortField : values()) {
                if (sortField.field.equalsIgnoreCase(field.trim())) {
                    return Optional.of(sortField);
                }
            }
            return Optional.empty();
        }
    }

    private static final Comparator<DetectionRecord> BY_ID = Comparator.comparing(DetectionRecord::getId);

    private RecordSorter() {
    }

    /**
     * Comparator for the requested field and order.
     *
     * @param sortBy requested field; unsupported values fall back to title ascending
     * @param sortOrder "asc" or "desc", anything else is ascending
     */
    public static Comparator<DetectionRecord> comparator(String sortBy, String sortOrder) {
        Optional<SortField> field = SortField.fromField(sortBy);
        if (field.isEmpty()) {
            log.warn("Unsupported sort field '{}', falling back to title ascending", sortBy);
            return SortField.TITLE.ascending.thenComparing(BY_ID);
        }
        boolean descending = sortOrder != null && "desc".equals(sortOrder.trim().toLowerCase(Locale.ROOT));
        Comparator<DetectionRecord> primary = descending ? field.get().descending : field.get().ascending;
        return primary.thenComparing(BY_ID);
    }

    public static boolean isSupported(String sortBy) {
        return SortField.fromField(sortBy).isPresent();
    }
}
