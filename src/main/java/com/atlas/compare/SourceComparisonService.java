package com.atlas.compare;

import com.atlas.domain.ComparisonResult;
import com.atlas.domain.DetectionRecord;
import com.atlas.domain.DetectionSource;
import com.atlas.exception.InvalidSelectionException;
import com.atlas.search.RecordSorter;
import com.atlas.store.DetectionRecordStore;
import com.atlas.taxonomy.TaxonomyIndex;
import com.atlas.taxonomy.TaxonomyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Cross-vendor lookup: every record matching a technique, keyword or
 * platform, grouped by source.
 *
 * When several criteria are given, technique takes precedence over
 * platform, and platform over keyword.
 */
@Service
public class SourceComparisonService {

    private static final Logger log = LoggerFactory.getLogger(SourceComparisonService.class);

    private final DetectionRecordStore store;
    private final TaxonomyProvider taxonomyProvider;

    public SourceComparisonService(DetectionRecordStore store, TaxonomyProvider taxonomyProvider) {
        this.store = store;
        this.taxonomyProvider = taxonomyProvider;
    }

    /**
     * @param technique technique id; sub-techniques of it match too
     * @param keyword text searched case-insensitively in detection logic and raw content
     * @param platform platform name, case-insensitive
     * @param sources sources to include; null or empty means all
     * @throws InvalidSelectionException if no criterion is given
     */
    public ComparisonResult compareBy(String technique, String keyword, String platform,
                                      Collection<DetectionSource> sources) {
        String queryType;
        String queryValue;
        Predicate<DetectionRecord> criterion;

        if (!isBlank(technique)) {
            queryType = "technique";
            queryValue = technique.trim();
            criterion = byTechnique(taxonomyProvider.current(), queryValue);
        } else if (!isBlank(platform)) {
            queryType = "platform";
            queryValue = platform.trim();
            criterion = byPlatform(queryValue);
        } else if (!isBlank(keyword)) {
            queryType = "keyword";
            queryValue = keyword.trim();
            criterion = byKeyword(queryValue);
        } else {
            throw new InvalidSelectionException("One of 'technique', 'keyword', or 'platform' is required");
        }

        Map<String, List<DetectionRecord>> grouped = new TreeMap<>();
        for (DetectionRecord record : store.snapshot().getRecords()) {
            if (sources != null && !sources.isEmpty() && !sources.contains(record.getSource())) {
                continue;
            }
            if (criterion.test(record)) {
                grouped.computeIfAbsent(record.getSource().getValue(), k -> new ArrayList<>()).add(record);
            }
        }

        Map<String, Integer> totals = new TreeMap<>();
        for (Map.Entry<String, List<DetectionRecord>> entry : grouped.entrySet()) {
            entry.getValue().sort(RecordSorter.comparator("title", "asc"));
            totals.put(entry.getKey(), entry.getValue().size());
        }

        log.debug("Compare by {} '{}' matched records in {} sources", queryType, queryValue, grouped.size());
        return new ComparisonResult(queryType, queryValue, grouped, totals);
    }

    private static Predicate<DetectionRecord> byTechnique(TaxonomyIndex taxonomy, String technique) {
        String target = taxonomy.resolve(technique).getTechniqueId();
        Set<String> matching = new HashSet<>(taxonomy.getSubtechniqueIds(target));
        matching.add(target);
        return record -> {
            for (String reference : record.getMitreTechniques()) {
                if (matching.contains(taxonomy.resolve(reference).getTechniqueId())) {
                    return true;
                }
            }
            return false;
        };
    }

    private static Predicate<DetectionRecord> byPlatform(String platform) {
        return record -> record.getPlatform().equalsIgnoreCase(platform);
    }

    private static Predicate<DetectionRecord> byKeyword(String keyword) {
        String needle = keyword.toLowerCase(Locale.ROOT);
        return record -> contains(record.getDetectionLogic(), needle) || contains(record.getRawContent(), needle);
    }

    private static boolean contains(String field, String needle) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
