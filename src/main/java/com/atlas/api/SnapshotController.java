package com.atlas.api;

import com.atlas.store.DetectionSnapshot;
import com.atlas.store.DetectionSnapshotLoader;
import com.atlas.taxonomy.TaxonomyIndex;
import com.atlas.taxonomy.TaxonomyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hook for the ingestion side: re-read the configured record and taxonomy
 * files and publish them as new snapshots. Requests already running keep
 * the snapshots they started with.
 */
@RestController
@RequestMapping("/api/snapshots")
public class SnapshotController {

    private static final Logger log = LoggerFactory.getLogger(SnapshotController.class);

    private final DetectionSnapshotLoader snapshotLoader;
    private final TaxonomyProvider taxonomyProvider;

    public SnapshotController(DetectionSnapshotLoader snapshotLoader, TaxonomyProvider taxonomyProvider) {
        this.snapshotLoader = snapshotLoader;
        this.taxonomyProvider = taxonomyProvider;
    }

    @PostMapping("/reload")
    public Map<String, Object> reload() {
        boolean taxonomyLoaded = taxonomyProvider.reload();
        DetectionSnapshot snapshot = snapshotLoader.reload();
        TaxonomyIndex taxonomy = taxonomyProvider.current();

        log.info("Snapshots reloaded: records v{} ({} records, {} rejected), taxonomy {} techniques",
            snapshot.getVersion(), snapshot.size(), snapshot.getRejectedCount(), taxonomy.getTechniqueCount());

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("snapshot_version", snapshot.getVersion());
        status.put("record_count", snapshot.size());
        status.put("rejected_count", snapshot.getRejectedCount());
        status.put("taxonomy_loaded", taxonomyLoaded);
        status.put("technique_count", taxonomy.getTechniqueCount());
        return status;
    }
}
