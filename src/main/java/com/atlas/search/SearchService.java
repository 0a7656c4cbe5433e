package com.atlas.search;

import com.atlas.domain.DetectionRecord;
import com.atlas.domain.RecordStatistics;
import com.atlas.domain.RuleStatus;
import com.atlas.domain.SearchFilters;
import com.atlas.domain.SearchResult;
import com.atlas.domain.Severity;
import com.atlas.exception.RecordNotFoundException;
import com.atlas.metrics.AnalysisMetrics;
import com.atlas.store.DetectionRecordStore;
import com.atlas.store.DetectionSnapshot;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Resolves {@link SearchFilters} against the detection record store.
 *
 * Every public method reads the store's snapshot once and works on that
 * reference only. Overloads taking a {@link DetectionSnapshot} let the
 * analytics services run several lookups against the same snapshot.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);
    private static final int TOP_N = 10;

    private final DetectionRecordStore store;
    private final AnalysisMetrics metrics;

    /**
     * @param store Holder of the current detection record snapshot
     * @param metrics Metrics collector for search count, latency and sort fallbacks
     */
    public SearchService(DetectionRecordStore store, AnalysisMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Filter, sort and paginate the current snapshot.
     *
     * This method:
     * 1. Compiles the facet selections and free text into one matcher
     * 2. Collects and sorts every match (severity by rank, nulls last, ties by id)
     * 3. Cuts the requested page; the total counts all matches
     *
     * @param filters the query; an unsupported sort field falls back to title ascending
     * @return the requested page and the total number of matches
     */
    public SearchResult search(SearchFilters filters) {
        return search(store.snapshot(), filters);
    }

    public SearchResult search(DetectionSnapshot snapshot, SearchFilters filters) {
        SearchFilters query = filters != null ? filters : new SearchFilters();
        Timer.Sample sample = metrics.startTimer();
        metrics.recordSearch();

        List<DetectionRecord> matches = findMatching(snapshot, query);
        int total = matches.size();
        int offset = Math.max(0, query.getOffset());
        int limit = query.getLimit() <= 0 ? SearchFilters.UNLIMITED : query.getLimit();

        List<DetectionRecord> page;
        if (offset >= total) {
            page = new ArrayList<>();
        } else {
            int end = (int) Math.min((long) offset + limit, total);
            page = new ArrayList<>(matches.subList(offset, end));
        }

        metrics.recordSearchLatency(sample);
        log.debug("Search matched {} of {} records, returning {} from offset {}",
            total, snapshot.size(), page.size(), offset);
        return new SearchResult(page, total, offset, limit);
    }

    /**
     * Every record of the snapshot matching the filters, sorted, without pagination.
     */
    public List<DetectionRecord> findMatching(DetectionSnapshot snapshot, SearchFilters filters) {
        if (!RecordSorter.isSupported(filters.getSortBy())) {
            metrics.recordSortFallback();
        }
        RecordMatcher matcher = RecordMatcher.compile(filters);
        Comparator<DetectionRecord> order = RecordSorter.comparator(filters.getSortBy(), filters.getSortOrder());

        List<DetectionRecord> matches = new ArrayList<>();
        for (DetectionRecord record : snapshot.getRecords()) {
            if (matcher.test(record)) {
                matches.add(record);
            }
        }
        matches.sort(order);
        return matches;
    }

    /**
     * @throws RecordNotFoundException if no record has the id
     */
    public DetectionRecord getRecord(String id) {
        return getRecord(store.snapshot(), id);
    }

    public DetectionRecord getRecord(DetectionSnapshot snapshot, String id) {
        return snapshot.findById(id)
            .orElseThrow(() -> new RecordNotFoundException("Detection", id));
    }

    /**
     * Records for the given ids in request order; unknown ids are skipped.
     */
    public List<DetectionRecord> findByIds(DetectionSnapshot snapshot, Collection<String> ids) {
        List<DetectionRecord> found = new ArrayList<>();
        for (String id : ids) {
            snapshot.findById(id).ifPresent(found::add);
        }
        return found;
    }

    /**
     * Counts by source, severity and status plus the most referenced
     * techniques and tactics.
     */
    public RecordStatistics statistics() {
        DetectionSnapshot snapshot = store.snapshot();

        Map<String, Integer> bySource = new LinkedHashMap<>();
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.getValue(), 0);
        }
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        for (RuleStatus status : RuleStatus.values()) {
            byStatus.put(status.getValue(), 0);
        }
        Map<String, Integer> techniqueCounts = new HashMap<>();
        Map<String, Integer> tacticCounts = new HashMap<>();

        for (DetectionRecord record : snapshot.getRecords()) {
            bySource.merge(record.getSource().getValue(), 1, Integer::sum);
            bySeverity.merge(record.getSeverity().getValue(), 1, Integer::sum);
            byStatus.merge(record.getStatus().getValue(), 1, Integer::sum);
            for (String technique : record.getMitreTechniques()) {
                techniqueCounts.merge(technique, 1, Integer::sum);
            }
            for (String tactic : record.getMitreTactics()) {
                tacticCounts.merge(tactic, 1, Integer::sum);
            }
        }

        return new RecordStatistics(snapshot.size(), bySource, bySeverity, byStatus,
            top(techniqueCounts), top(tacticCounts));
    }

    /**
     * Values selectable per facet: the closed value set for enumerated facets,
     * otherwise the distinct values present in the snapshot.
     */
    public Map<String, List<String>> filterOptions() {
        DetectionSnapshot snapshot = store.snapshot();
        Map<String, List<String>> options = new LinkedHashMap<>();
        for (FacetDefinition facet : FacetDefinition.values()) {
            if (facet.getAllowedValues() != null) {
                options.put(facet.getField(), facet.getAllowedValues());
                continue;
            }
            TreeSet<String> distinct = new TreeSet<>();
            for (DetectionRecord record : snapshot.getRecords()) {
                for (String value : facet.valuesOf(record)) {
                    if (value != null && !value.isEmpty()) {
                        distinct.add(value);
                    }
                }
            }
            options.put(facet.getField(), new ArrayList<>(distinct));
        }
        return options;
    }

    private static List<RecordStatistics.CountEntry> top(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed()
            .thenComparing(Map.Entry.<String, Integer>comparingByKey()));
        List<RecordStatistics.CountEntry> result = new ArrayList<>();
        for (int i = 0; i < Math.min(TOP_N, entries.size()); i++) {
            result.add(new RecordStatistics.CountEntry(entries.get(i).getKey(), entries.get(i).getValue()));
        }
        return result;
    }
}
