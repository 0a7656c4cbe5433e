package com.atlas.coverage;

import com.atlas.domain.CoverageMatrix;
import com.atlas.domain.CoverageSummary;
import com.atlas.domain.DetectionRecord;
import com.atlas.domain.DetectionSource;
import com.atlas.domain.Tactic;
import com.atlas.domain.TacticCoverage;
import com.atlas.domain.Technique;
import com.atlas.domain.TechniqueCoverage;
import com.atlas.exception.InvalidSelectionException;
import com.atlas.metrics.AnalysisMetrics;
import com.atlas.store.DetectionRecordStore;
import com.atlas.store.DetectionSnapshot;
import com.atlas.taxonomy.TaxonomyIndex;
import com.atlas.taxonomy.TaxonomyProvider;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Builds the tactic x technique x source coverage matrix.
 *
 * Algorithm:
 * 1. Index the records of the requested sources by resolved technique id
 * 2. Walk the non-deprecated tactics in kill-chain order and list their
 *    techniques, plus any technique rule metadata placed under the tactic
 * 3. Count distinct records per technique and source; with sub-techniques
 *    enabled a parent also counts the records of its sub-techniques
 * 4. Summarize coverage over the distinct technique ids in the matrix
 *
 * Results are cached per (record snapshot, taxonomy, options) for a bounded
 * time; a new snapshot of either input produces new keys.
 */
@Service
public class CoverageMatrixBuilder {

    private static final Logger log = LoggerFactory.getLogger(CoverageMatrixBuilder.class);

    private final DetectionRecordStore store;
    private final TaxonomyProvider taxonomyProvider;
    private final AnalysisMetrics metrics;

    /**
     * Caffeine cache for computed matrices
     * - Key: record snapshot version, taxonomy generation, sources, sub-technique flag, tactic
     * - TTL: configurable, expires after write
     * - Records cache statistics for monitoring
     */
    private final Cache<String, CoverageMatrix> cache;

    /**
     * Constructor with dependency injection for the snapshot holders
     *
     * @param store Holder of the current detection record snapshot
     * @param taxonomyProvider Holder of the current ATT&CK taxonomy
     * @param metrics Metrics collector for coverage computation and cache use
     * @param cacheTtlMinutes Minutes a computed matrix stays cached
     * @param cacheMaxSize Maximum number of cached matrices
     */
    public CoverageMatrixBuilder(
            DetectionRecordStore store,
            TaxonomyProvider taxonomyProvider,
            AnalysisMetrics metrics,
            @Value("${atlas.cache.ttl-minutes:5}") int cacheTtlMinutes,
            @Value("${atlas.cache.max-size:100}") int cacheMaxSize) {
        this.store = store;
        this.taxonomyProvider = taxonomyProvider;
        this.metrics = metrics;
        this.cache = Caffeine.newBuilder()
            .maximumSize(cacheMaxSize)
            .expireAfterWrite(cacheTtlMinutes, TimeUnit.MINUTES)
            .recordStats()
            .build();

        log.info("CoverageMatrixBuilder initialized with cache (TTL={}min, maxSize={})",
            cacheTtlMinutes, cacheMaxSize);
    }

    /**
     * Build the matrix over the current snapshots.
     *
     * This method:
     * 1. Takes one reference to the record snapshot and one to the taxonomy
     * 2. Validates the optional tactic filter
     * 3. Returns the cached matrix for the same snapshots and options if present
     * 4. Otherwise computes the matrix, records latency and unresolvable ids, and caches it
     *
     * @param sources sources to tabulate; empty means every source present in the records
     * @param includeSubtechniques list sub-techniques and roll their counts into parents
     * @param tacticId optional tactic to restrict the matrix to
     * @throws InvalidSelectionException if tacticId names no tactic
     */
    public CoverageMatrix build(Collection<DetectionSource> sources, boolean includeSubtechniques, String tacticId) {
        DetectionSnapshot snapshot = store.snapshot();
        TaxonomyIndex taxonomy = taxonomyProvider.current();

        String tacticFilter = null;
        if (tacticId != null && !tacticId.isBlank()) {
            tacticFilter = taxonomy.resolveTactic(tacticId)
                .map(Tactic::getId)
                .orElseThrow(() -> new InvalidSelectionException("Invalid tactic ID: " + tacticId));
        }

        Set<DetectionSource> requested = sources == null || sources.isEmpty()
            ? EnumSet.noneOf(DetectionSource.class)
            : EnumSet.copyOf(sources);
        String key = snapshot.getVersion() + "|" + taxonomy.getGeneration() + "|" + requested
            + "|" + includeSubtechniques + "|" + tacticFilter;

        CoverageMatrix cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Cache hit for coverage matrix {}", key);
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();

        Timer.Sample sample = metrics.startTimer();
        CoverageMatrix matrix = compute(snapshot.getRecords(), taxonomy, requested, includeSubtechniques, tacticFilter);
        metrics.recordCoverageLatency(sample);
        metrics.recordCoverageBuild();
        metrics.recordUnresolvableTechniques(matrix.getSummary().getUnresolvableCount());
        cache.put(key, matrix);

        log.info("Coverage matrix built for snapshot v{}: {} techniques, {}% covered, {} unresolvable ids",
            snapshot.getVersion(), matrix.getSummary().getTotalTechniques(),
            matrix.getSummary().getOverallCoveragePercent(), matrix.getSummary().getUnresolvableCount());
        return matrix;
    }

    public CoverageMatrix build(Collection<DetectionSource> sources, boolean includeSubtechniques) {
        return build(sources, includeSubtechniques, null);
    }

    /**
     * Pure computation over explicit inputs.
     *
     * @param records records to tabulate
     * @param taxonomy taxonomy the technique ids are resolved against
     * @param requested sources to tabulate; empty means every source present in the records
     * @param includeSubtechniques list sub-techniques and roll their counts into parents
     * @param tacticFilter resolved tactic id to restrict to, or null for all tactics
     * @return the matrix with its summary block
     */
    static CoverageMatrix compute(Collection<DetectionRecord> records, TaxonomyIndex taxonomy,
                                  Set<DetectionSource> requested, boolean includeSubtechniques,
                                  String tacticFilter) {
        TechniqueRecordIndex index = TechniqueRecordIndex.build(records, taxonomy, requested);

        List<DetectionSource> sources = new ArrayList<>();
        if (requested.isEmpty()) {
            TreeSet<String> present = new TreeSet<>();
            for (DetectionRecord record : records) {
                present.add(record.getSource().getValue());
            }
            for (String value : present) {
                sources.add(DetectionSource.fromValue(value));
            }
        } else {
            sources.addAll(requested);
            sources.sort((a, b) -> a.getValue().compareTo(b.getValue()));
        }

        List<TacticCoverage> tactics = new ArrayList<>();
        Map<String, TechniqueCoverage> distinct = new LinkedHashMap<>();

        for (Tactic tactic : taxonomy.getTactics()) {
            if (tactic.isDeprecated() || (tacticFilter != null && !tacticFilter.equals(tactic.getId()))) {
                continue;
            }

            List<TechniqueCoverage> rows = new ArrayList<>();
            for (Map.Entry<Technique, Boolean> entry
                    : listTechniques(tactic, taxonomy, index, includeSubtechniques).entrySet()) {
                TechniqueCoverage row = countTechnique(entry.getKey(), entry.getValue(), sources,
                    taxonomy, index, includeSubtechniques);
                rows.add(row);
                distinct.putIfAbsent(row.getId(), row);
            }
            if (!rows.isEmpty()) {
                tactics.add(new TacticCoverage(tactic, rows));
            }
        }

        int covered = 0;
        for (TechniqueCoverage row : distinct.values()) {
            if (row.isCovered()) {
                covered++;
            }
        }
        Map<String, CoverageSummary.SourceCoverage> sourceCoverage = new LinkedHashMap<>();
        for (DetectionSource source : sources) {
            int sourceCovered = 0;
            for (TechniqueCoverage row : distinct.values()) {
                if (row.getCoverage().getOrDefault(source.getValue(), 0) > 0) {
                    sourceCovered++;
                }
            }
            sourceCoverage.put(source.getValue(), new CoverageSummary.SourceCoverage(sourceCovered, distinct.size()));
        }

        List<String> sourceNames = new ArrayList<>();
        for (DetectionSource source : sources) {
            sourceNames.add(source.getValue());
        }
        CoverageSummary summary = new CoverageSummary(tactics.size(), distinct.size(), covered, sourceCoverage,
            new ArrayList<>(index.getUnresolvable()), index.getRemappedCount());
        return new CoverageMatrix(sourceNames, tactics, summary);
    }

    /**
     * Techniques listed under a tactic, mapped to whether the membership is
     * canonical, ordered parents first and then by id.
     */
    private static Map<Technique, Boolean> listTechniques(Tactic tactic, TaxonomyIndex taxonomy,
                                                          TechniqueRecordIndex index,
                                                          boolean includeSubtechniques) {
        List<Technique> ordered = new ArrayList<>(taxonomy.listTechniquesByTactic(tactic.getId(), includeSubtechniques));
        Set<String> listed = new HashSet<>();
        for (Technique technique : ordered) {
            listed.add(technique.getId());
        }
        Set<String> canonical = new HashSet<>(listed);

        for (String placed : index.placementsFor(tactic.getId())) {
            if (listed.contains(placed)) {
                continue;
            }
            Optional<Technique> technique = taxonomy.getTechnique(placed);
            if (technique.isEmpty() || technique.get().isDeprecated()) {
                continue;
            }
            if (technique.get().isSubtechnique() && !includeSubtechniques) {
                continue;
            }
            ordered.add(technique.get());
            listed.add(placed);
        }
        ordered.sort(TaxonomyIndex.TECHNIQUE_ORDER);

        Map<Technique, Boolean> result = new LinkedHashMap<>();
        for (Technique technique : ordered) {
            result.put(technique, canonical.contains(technique.getId()));
        }
        return result;
    }

    private static TechniqueCoverage countTechnique(Technique technique, boolean canonical,
                                                    List<DetectionSource> sources, TaxonomyIndex taxonomy,
                                                    TechniqueRecordIndex index, boolean includeSubtechniques) {
        boolean rollUp = includeSubtechniques && !technique.isSubtechnique();
        List<String> subtechniques = rollUp
            ? taxonomy.getSubtechniqueIds(technique.getId())
            : List.of();

        Map<String, Integer> coverage = new LinkedHashMap<>();
        int total = 0;
        for (DetectionSource source : sources) {
            Set<String> ids = index.recordIds(technique.getId(), source);
            if (!subtechniques.isEmpty()) {
                ids = new HashSet<>(ids);
                for (String subtechnique : subtechniques) {
                    ids.addAll(index.recordIds(subtechnique, source));
                }
            }
            coverage.put(source.getValue(), ids.size());
            total += ids.size();
        }
        return new TechniqueCoverage(technique, coverage, total, canonical);
    }
}
