package com.atlas.store;

import com.atlas.domain.DetectionSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.atlas.TestData.record;
import static org.assertj.core.api.Assertions.assertThat;

class DetectionRecordStoreTest {

    @Test
    void testPublish_ShouldSwapSnapshotAndBumpVersion() {
        // Given: A store with a first snapshot held by a running request
        DetectionRecordStore store = new DetectionRecordStore();
        DetectionSnapshot first = store.publish(List.of(record("r1", DetectionSource.SIGMA, "T1059")));

        // When: A new snapshot is published
        DetectionSnapshot second = store.publish(List.of(
            record("r1", DetectionSource.SIGMA, "T1059"),
            record("r2", DetectionSource.ELASTIC, "T1055")));

        // Then: New readers see the new snapshot, the old one is unchanged
        assertThat(store.snapshot()).isSameAs(second);
        assertThat(second.getVersion()).isGreaterThan(first.getVersion());
        assertThat(first.size()).isEqualTo(1);
        assertThat(second.size()).isEqualTo(2);
    }

    @Test
    void testSnapshot_DuplicateIds_LastOneWins() {
        DetectionRecordStore store = new DetectionRecordStore();

        DetectionSnapshot snapshot = store.publish(List.of(
            record("r1", DetectionSource.SIGMA, "T1059"),
            record("r1", DetectionSource.ELASTIC, "T1055")));

        assertThat(snapshot.size()).isEqualTo(1);
        assertThat(snapshot.findById("r1").orElseThrow().getSource()).isEqualTo(DetectionSource.ELASTIC);
    }

    @Test
    void testSnapshot_Initially_ShouldBeEmpty() {
        assertThat(new DetectionRecordStore().snapshot().size()).isZero();
    }
}
