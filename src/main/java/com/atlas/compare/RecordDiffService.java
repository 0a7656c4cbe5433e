package com.atlas.compare;

import com.atlas.domain.DetectionRecord;
import com.atlas.domain.DiffResult;
import com.atlas.domain.FieldComparison;
import com.atlas.exception.InvalidSelectionException;
import com.atlas.exception.RecordNotFoundException;
import com.atlas.metrics.AnalysisMetrics;
import com.atlas.store.DetectionRecordStore;
import com.atlas.store.DetectionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Field-level comparison of 2 to 6 records.
 *
 * A field differs when not all selected records carry the same canonical
 * value for it (see {@link ComparableField}).
 */
@Service
public class RecordDiffService {

    private static final Logger log = LoggerFactory.getLogger(RecordDiffService.class);

    public static final int MIN_SELECTION = 2;
    public static final int MAX_SELECTION = 6;

    private final DetectionRecordStore store;
    private final AnalysisMetrics metrics;

    public RecordDiffService(DetectionRecordStore store, AnalysisMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * @param ids record ids in panel order
     * @throws InvalidSelectionException if fewer than 2 or more than 6 ids are given
     * @throws RecordNotFoundException if an id names no record
     */
    public DiffResult diff(List<String> ids) {
        int size = ids == null ? 0 : ids.size();
        if (size < MIN_SELECTION || size > MAX_SELECTION) {
            throw new InvalidSelectionException(
                "Must provide " + MIN_SELECTION + "-" + MAX_SELECTION + " detection IDs for comparison", size);
        }

        DetectionSnapshot snapshot = store.snapshot();
        List<DetectionRecord> records = new ArrayList<>(size);
        for (String id : ids) {
            records.add(snapshot.findById(id)
                .orElseThrow(() -> new RecordNotFoundException("Detection", id)));
        }

        DiffResult result = compare(records);
        metrics.recordDiff();
        log.debug("Diff over {} records, differing fields: {}", size, result.getDifferingFields());
        return result;
    }

    /**
     * Compare any number of already loaded records; a single record never
     * produces a flagged field.
     */
    public static DiffResult compare(List<DetectionRecord> records) {
        List<FieldComparison> rows = new ArrayList<>();
        for (ComparableField field : ComparableField.values()) {
            List<Object> values = new ArrayList<>(records.size());
            for (DetectionRecord record : records) {
                values.add(field.valueOf(record));
            }
            rows.add(new FieldComparison(field.getField(), values, field.isFlaggable() && !allEqual(values)));
        }
        return new DiffResult(records, rows);
    }

    private static boolean allEqual(List<Object> values) {
        for (int i = 1; i < values.size(); i++) {
            if (!Objects.equals(values.get(0), values.get(i))) {
                return false;
            }
        }
        return true;
    }
}
