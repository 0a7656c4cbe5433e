package com.atlas.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for search, coverage, comparison and export operations.
 * Tracks request counts and latency, recovered data-quality issues and the
 * analysis cache hit rate.
 */
@Component
public class AnalysisMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter searchesExecuted;
    private final Counter sortFallbacks;
    private final Counter coverageBuilds;
    private final Counter gapAnalyses;
    private final Counter diffsExecuted;
    private final Counter exportsCompleted;
    private final Counter exportsCancelled;
    private final Counter unresolvableTechniques;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Timer searchLatency;
    private final Timer coverageLatency;
    private final DistributionSummary exportSize;

    public AnalysisMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        searchesExecuted = Counter.builder("atlas.search.executed")
            .description("Total number of record searches executed")
            .register(meterRegistry);

        sortFallbacks = Counter.builder("atlas.search.sort.fallback")
            .description("Searches whose sort field was invalid and fell back to title")
            .register(meterRegistry);

        coverageBuilds = Counter.builder("atlas.coverage.built")
            .description("Coverage matrices computed (cache misses)")
            .register(meterRegistry);

        gapAnalyses = Counter.builder("atlas.coverage.gap.executed")
            .description("Gap analyses computed")
            .register(meterRegistry);

        diffsExecuted = Counter.builder("atlas.compare.diff.executed")
            .description("Side-by-side record diffs computed")
            .register(meterRegistry);

        exportsCompleted = Counter.builder("atlas.export.completed")
            .description("Exports streamed to completion")
            .register(meterRegistry);

        exportsCancelled = Counter.builder("atlas.export.cancelled")
            .description("Exports aborted by cancellation")
            .register(meterRegistry);

        unresolvableTechniques = Counter.builder("atlas.taxonomy.unresolvable")
            .description("Technique references that matched no current technique")
            .register(meterRegistry);

        cacheHits = Counter.builder("atlas.cache.hits")
            .description("Analysis cache hits")
            .register(meterRegistry);

        cacheMisses = Counter.builder("atlas.cache.misses")
            .description("Analysis cache misses")
            .register(meterRegistry);

        searchLatency = Timer.builder("atlas.search.latency")
            .description("Latency of record searches")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(10))
            .register(meterRegistry);

        coverageLatency = Timer.builder("atlas.coverage.latency")
            .description("Latency of coverage matrix computation")
            .publishPercentiles(0.5, 0.95, 0.99)
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        exportSize = DistributionSummary.builder("atlas.export.size")
            .description("Number of records per export")
            .baseUnit("records")
            .register(meterRegistry);
    }

    public void recordSearch() {
        searchesExecuted.increment();
    }

    public void recordSortFallback() {
        sortFallbacks.increment();
    }

    public void recordCoverageBuild() {
        coverageBuilds.increment();
    }

    public void recordGapAnalysis() {
        gapAnalyses.increment();
    }

    public void recordDiff() {
        diffsExecuted.increment();
    }

    public void recordExportCompleted(long records) {
        exportsCompleted.increment();
        exportSize.record(records);
    }

    public void recordExportCancelled() {
        exportsCancelled.increment();
    }

    public void recordUnresolvableTechniques(int count) {
        if (count > 0) {
            unresolvableTechniques.increment(count);
        }
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordSearchLatency(Timer.Sample sample) {
        sample.stop(searchLatency);
    }

    public void recordCoverageLatency(Timer.Sample sample) {
        sample.stop(coverageLatency);
    }

    /**
     * Calculate cache hit rate as a percentage
     * @return cache hit rate (0-100) or 0 if no cache operations
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        if (total == 0) {
            return 0.0;
        }
        return (hits / total) * 100.0;
    }

    // Getter methods for testing

    public Counter getSearchesExecuted() {
        return searchesExecuted;
    }

    public Counter getSortFallbacks() {
        return sortFallbacks;
    }

    public Counter getCoverageBuilds() {
        return coverageBuilds;
    }

    public Counter getExportsCompleted() {
        return exportsCompleted;
    }

    public Counter getExportsCancelled() {
        return exportsCancelled;
    }

    public Counter getUnresolvableTechniques() {
        return unresolvableTechniques;
    }

    public Counter getCacheHits() {
        return cacheHits;
    }

    public Counter getCacheMisses() {
        return cacheMisses;
    }
}
