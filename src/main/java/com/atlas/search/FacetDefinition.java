package com.atlas.search;

import com.atlas.domain.DetectionRecord;
import com.atlas.domain.DetectionSource;
import com.atlas.domain.RuleStatus;
import com.atlas.domain.SearchFilters;
import com.atlas.domain.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Fixed table of the search facets.
 *
 * Each entry names the facet, how a record is tested against a selection,
 * where the selection lives in {@link SearchFilters}, which record values it
 * is tested against and, for enumerated facets, the values a selection may
 * take. Matching is case-insensitive for every facet.
 */
public enum FacetDefinition {

    SOURCES("sources", MatchMode.EXACT, SearchFilters::getSources,
        r -> single(r.getSource().getValue()), enumValues(DetectionSource.values(), DetectionSource::getValue)),
    STATUSES("statuses", MatchMode.EXACT, SearchFilters::getStatuses,
        r -> single(r.getStatus().getValue()), enumValues(RuleStatus.values(), RuleStatus::getValue)),
    SEVERITIES("severities", MatchMode.EXACT, SearchFilters::getSeverities,
        r -> single(r.getSeverity().getValue()), enumValues(Severity.values(), Severity::getValue)),
    LANGUAGES("languages", MatchMode.EXACT, SearchFilters::getLanguages,
        r -> single(r.getLanguage()), null),
    MITRE_TACTICS("mitre_tactics", MatchMode.INTERSECTS, SearchFilters::getMitreTactics,
        DetectionRecord::getMitreTactics, null),
    MITRE_TECHNIQUES("mitre_techniques", MatchMode.INTERSECTS, SearchFilters::getMitreTechniques,
        DetectionRecord::getMitreTechniques, null),
    TAGS("tags", MatchMode.INTERSECTS, SearchFilters::getTags,
        DetectionRecord::getTags, null),
    LOG_SOURCES("log_sources", MatchMode.INTERSECTS, SearchFilters::getLogSources,
        DetectionRecord::getLogSources, null),
    PLATFORMS("platforms", MatchMode.EXACT, SearchFilters::getPlatforms,
        r -> single(r.getPlatform()), null),
    EVENT_CATEGORIES("event_categories", MatchMode.EXACT, SearchFilters::getEventCategories,
        r -> single(r.getEventCategory()), null),
    DATA_SOURCES_NORMALIZED("data_sources_normalized", MatchMode.EXACT, SearchFilters::getDataSourcesNormalized,
        r -> single(r.getDataSourceNormalized()), null);

    /**
     * How a record value is tested against a facet selection.
     */
    public enum MatchMode {
        /** The record's single value must be one of the selected values. */
        EXACT,
        /** The record's value set must share at least one element with the selection. */
        INTERSECTS
    }

    private final String field;
    private final MatchMode mode;
    private final Function<SearchFilters, List<String>> selection;
    private final Function<DetectionRecord, Collection<String>> recordValues;
    private final List<String> allowedValues;

    FacetDefinition(String field, MatchMode mode,
                    Function<SearchFilters, List<String>> selection,
                    Function<DetectionRecord, Collection<String>> recordValues,
                    List<String> allowedValues) {
        this.field = field;
        this.mode = mode;
        this.selection = selection;
        this.recordValues = recordValues;
        this.allowedValues = allowedValues;
    }

    public String getField() {
        return field;
    }

    public MatchMode getMode() {
        return mode;
    }

    public List<String> selectionOf(SearchFilters filters) {
        List<String> selected = selection.apply(filters);
        return selected != null ? selected : Collections.emptyList();
    }

    public Collection<String> valuesOf(DetectionRecord record) {
        return recordValues.apply(record);
    }

    /**
     * @return the closed value set of an enumerated facet, or null for free-valued facets
     */
    public List<String> getAllowedValues() {
        return allowedValues;
    }

    private static Collection<String> single(String value) {
        return value == null || value.isEmpty() ? Collections.emptyList() : Collections.singletonList(value);
    }

    private static <E> List<String> enumValues(E[] constants, Function<E, String> value) {
        List<String> values = new ArrayList<>();
        for (E constant : constants) {
            values.add(value.apply(constant));
        }
        return Collections.unmodifiableList(values);
    }
}
