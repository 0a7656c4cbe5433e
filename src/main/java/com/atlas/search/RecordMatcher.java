package com.atlas.search;

import com.atlas.domain.DetectionRecord;
import com.atlas.domain.SearchFilters;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Predicate compiled from {@link SearchFilters}.
 *
 * A record matches iff every non-empty facet selection matches (see
 * {@link FacetDefinition}) and, when free text is given, the text occurs as a
 * case-insensitive substring of the title, description, detection logic or
 * author. No tokenization is applied: "power shell" does not match "PowerShell".
 */
public final class RecordMatcher implements Predicate<DetectionRecord> {

    private final String searchText;
    private final Map<FacetDefinition, Set<String>> selections;

    private RecordMatcher(String searchText, Map<FacetDefinition, Set<String>> selections) {
        this.searchText = searchText;
        this.selections = selections;
    }

    public static RecordMatcher compile(SearchFilters filters) {
        String text = filters.getSearch();
        String searchText = text == null || text.trim().isEmpty() ? null : text.trim().toLowerCase(Locale.ROOT);

        Map<FacetDefinition, Set<String>> selections = new EnumMap<>(FacetDefinition.class);
        for (FacetDefinition facet : FacetDefinition.values()) {
            Set<String> selected = lowerCase(facet.selectionOf(filters));
            if (!selected.isEmpty()) {
                selections.put(facet, selected);
            }
        }
        return new RecordMatcher(searchText, selections);
    }

    @Override
    public boolean test(DetectionRecord record) {
        for (Map.Entry<FacetDefinition, Set<String>> entry : selections.entrySet()) {
            if (!intersects(entry.getKey().valuesOf(record), entry.getValue())) {
                return false;
            }
        }
        return searchText == null || matchesText(record);
    }

    /**
     * Facets with an active selection, in declaration order.
     */
    public List<FacetDefinition> activeFacets() {
        return new ArrayList<>(selections.keySet());
    }

    private boolean matchesText(DetectionRecord record) {
        return contains(record.getTitle())
            || contains(record.getDescription())
            || contains(record.getDetectionLogic())
            || contains(record.getAuthor());
    }

    private boolean contains(String field) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(searchText);
    }

    private static boolean intersects(Collection<String> values, Set<String> selected) {
        for (String value : values) {
            if (value != null && selected.contains(value.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> lowerCase(List<String> values) {
        Set<String> result = new HashSet<>();
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                result.add(value.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
