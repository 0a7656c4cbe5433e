package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Technique coverage difference between two sources.
 *
 * {@code gaps} holds techniques only the base source detects,
 * {@code unique_to_compare} those only the compare source detects.
 * All lists are sorted.
 */
public class GapResult {

    @JsonProperty("base_source")
    private final String baseSource;

    @JsonProperty("compare_source")
    private final String compareSource;

    @JsonProperty("base_technique_count")
    private final int baseTechniqueCount;

    @JsonProperty("compare_technique_count")
    private final int compareTechniqueCount;

    @JsonProperty("overlap_count")
    private final int overlapCount;

    @JsonProperty("gaps")
    private final List<String> gaps;

    @JsonProperty("unique_to_compare")
    private final List<String> uniqueToCompare;

    @JsonProperty("unresolvable_techniques")
    private final List<String> unresolvableTechniques;

    public GapResult(String baseSource, String compareSource, int baseTechniqueCount, int compareTechniqueCount,
                     int overlapCount, List<String> gaps, List<String> uniqueToCompare,
                     List<String> unresolvableTechniques) {
        this.baseSource = baseSource;
        this.compareSource = compareSource;
        this.baseTechniqueCount = baseTechniqueCount;
        this.compareTechniqueCount = compareTechniqueCount;
        this.overlapCount = overlapCount;
        this.gaps = Collections.unmodifiableList(gaps);
        this.uniqueToCompare = Collections.unmodifiableList(uniqueToCompare);
        this.unresolvableTechniques = Collections.unmodifiableList(unresolvableTechniques);
    }

    public String getBaseSource() {
        return baseSource;
    }

    public String getCompareSource() {
        return compareSource;
    }

    public int getBaseTechniqueCount() {
        return baseTechniqueCount;
    }

    public int getCompareTechniqueCount() {
        return compareTechniqueCount;
    }

    public int getOverlapCount() {
        return overlapCount;
    }

    public List<String> getGaps() {
        return gaps;
    }

    public List<String> getUniqueToCompare() {
        return uniqueToCompare;
    }

    public List<String> getUnresolvableTechniques() {
        return unresolvableTechniques;
    }
}
