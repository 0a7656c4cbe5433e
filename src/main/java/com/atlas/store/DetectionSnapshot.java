package com.atlas.store;

import com.atlas.domain.DetectionRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the detection records produced by one ingestion run.
 *
 * The version increases with every snapshot the store accepts and is used as
 * part of cache keys, so derived views never outlive the data they came from.
 */
public final class DetectionSnapshot {

    private final long version;
    private final Instant loadedAt;
    private final List<DetectionRecord> records;
    private final Map<String, DetectionRecord> byId;
    private final int rejectedCount;

    public DetectionSnapshot(long version, Collection<DetectionRecord> records, int rejectedCount) {
        this.version = version;
        this.loadedAt = Instant.now();
        Map<String, DetectionRecord> index = new LinkedHashMap<>();
        for (DetectionRecord record : records) {
            // last write wins for duplicate ids, matching re-ingestion semantics
            index.put(record.getId(), record);
        }
        this.byId = Collections.unmodifiableMap(index);
        this.records = Collections.unmodifiableList(new ArrayList<>(index.values()));
        this.rejectedCount = rejectedCount;
    }

    public static DetectionSnapshot empty() {
        return new DetectionSnapshot(0L, Collections.emptyList(), 0);
    }

    public long getVersion() {
        return version;
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    public List<DetectionRecord> getRecords() {
        return records;
    }

    public Optional<DetectionRecord> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return records.size();
    }

    /**
     * Number of entries the loader could not turn into records.
     */
    public int getRejectedCount() {
        return rejectedCount;
    }
}
