package com.atlas.coverage;

import com.atlas.domain.DetectionSource;
import com.atlas.domain.GapResult;
import com.atlas.metrics.AnalysisMetrics;
import com.atlas.store.DetectionRecordStore;
import com.atlas.store.DetectionSnapshot;
import com.atlas.taxonomy.TaxonomyIndex;
import com.atlas.taxonomy.TaxonomyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pairwise technique coverage gaps between two sources.
 *
 * Technique ids are resolved to their current ids before the set
 * operations so a deprecated id on one side still overlaps its replacement
 * on the other. Ids that resolve to nothing take part under their original
 * spelling and are reported in the result.
 */
@Service
public class GapAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(GapAnalysisService.class);

    private final DetectionRecordStore store;
    private final TaxonomyProvider taxonomyProvider;
    private final AnalysisMetrics metrics;

    /**
     * @param store Holder of the current detection record snapshot
     * @param taxonomyProvider Holder of the current ATT&CK taxonomy
     * @param metrics Metrics collector for gap analyses and unresolvable ids
     */
    public GapAnalysisService(DetectionRecordStore store, TaxonomyProvider taxonomyProvider, AnalysisMetrics metrics) {
        this.store = store;
        this.taxonomyProvider = taxonomyProvider;
        this.metrics = metrics;
    }

    /**
     * @param base the source whose coverage is examined
     * @param compare the source it is measured against
     * @return techniques only base covers ({@code gaps}), techniques only
     *         compare covers ({@code unique_to_compare}) and the overlap count
     */
    public GapResult gap(DetectionSource base, DetectionSource compare) {
        DetectionSnapshot snapshot = store.snapshot();
        TaxonomyIndex taxonomy = taxonomyProvider.current();

        GapResult result = compute(snapshot, taxonomy, base, compare);
        metrics.recordGapAnalysis();
        metrics.recordUnresolvableTechniques(result.getUnresolvableTechniques().size());

        log.debug("Gap {} vs {}: {} gaps, {} unique to compare, {} overlapping",
            base.getValue(), compare.getValue(), result.getGaps().size(),
            result.getUniqueToCompare().size(), result.getOverlapCount());
        return result;
    }

    /**
     * Compute the gap between two sources over explicit snapshots.
     *
     * This method:
     * 1. Indexes the records of both sources by resolved technique id
     * 2. Takes each source's distinct technique set, unresolvable ids included
     * 3. Derives {@code gaps} (base only), {@code unique_to_compare} (compare only)
     *    and the overlap count from the two sets
     *
     * Swapping base and compare swaps the two lists and keeps the overlap.
     *
     * @param snapshot record snapshot taken for this request
     * @param taxonomy taxonomy taken for this request
     * @param base the source whose coverage is examined
     * @param compare the source it is measured against
     * @return sorted technique lists, counts and the unresolvable ids seen
     */
    static GapResult compute(DetectionSnapshot snapshot, TaxonomyIndex taxonomy,
                             DetectionSource base, DetectionSource compare) {
        TechniqueRecordIndex index =
            TechniqueRecordIndex.build(snapshot.getRecords(), taxonomy, EnumSet.of(base, compare));

        Set<String> baseTechniques = index.techniquesOf(base);
        Set<String> compareTechniques = index.techniquesOf(compare);

        TreeSet<String> gaps = new TreeSet<>(baseTechniques);
        gaps.removeAll(compareTechniques);
        TreeSet<String> uniqueToCompare = new TreeSet<>(compareTechniques);
        uniqueToCompare.removeAll(baseTechniques);
        int overlap = 0;
        for (String technique : baseTechniques) {
            if (compareTechniques.contains(technique)) {
                overlap++;
            }
        }

        return new GapResult(base.getValue(), compare.getValue(),
            baseTechniques.size(), compareTechniques.size(), overlap,
            new ArrayList<>(gaps), new ArrayList<>(uniqueToCompare),
            List.copyOf(index.getUnresolvable()));
    }
}
