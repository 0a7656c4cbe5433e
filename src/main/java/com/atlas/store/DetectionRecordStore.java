package com.atlas.store;

import com.atlas.domain.DetectionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory store of normalized detection records.
 *
 * The store owns a single {@link DetectionSnapshot} reference. Ingestion
 * publishes a complete new snapshot through {@link #publish(Collection, int)};
 * readers call {@link #snapshot()} once per request and never see a
 * half-applied update.
 */
@Repository
public class DetectionRecordStore {

    private static final Logger log = LoggerFactory.getLogger(DetectionRecordStore.class);

    private final AtomicReference<DetectionSnapshot> current = new AtomicReference<>(DetectionSnapshot.empty());
    private final AtomicLong versions = new AtomicLong();

    public DetectionSnapshot snapshot() {
        return current.get();
    }

    /**
     * Publish a new snapshot built from the given records.
     *
     * @param records the full record set of the ingestion run
     * @param rejectedCount entries the ingestion side could not normalize
     * @return the snapshot now being served
     */
    public DetectionSnapshot publish(Collection<DetectionRecord> records, int rejectedCount) {
        if (records == null) {
            throw new IllegalArgumentException("Records must not be null");
        }
        DetectionSnapshot snapshot = new DetectionSnapshot(versions.incrementAndGet(), records, rejectedCount);
        current.set(snapshot);
        log.info("Published detection snapshot v{} with {} records ({} rejected)",
            snapshot.getVersion(), snapshot.size(), rejectedCount);
        return snapshot;
    }

    public DetectionSnapshot publish(Collection<DetectionRecord> records) {
        return publish(records, 0);
    }
}
