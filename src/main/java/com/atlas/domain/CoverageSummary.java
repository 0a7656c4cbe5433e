package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Summary block of a {@link CoverageMatrix}. Percentages are integers rounded
 * half up; technique counts are of distinct technique ids.
 */
public class CoverageSummary {

    @JsonProperty("total_tactics")
    private final int totalTactics;

    @JsonProperty("total_techniques")
    private final int totalTechniques;

    @JsonProperty("techniques_with_any_coverage")
    private final int techniquesWithAnyCoverage;

    @JsonProperty("overall_coverage_percent")
    private final int overallCoveragePercent;

    @JsonProperty("source_coverage")
    private final Map<String, SourceCoverage> sourceCoverage;

    @JsonProperty("unresolvable_techniques")
    private final List<String> unresolvableTechniques;

    @JsonProperty("remapped_technique_count")
    private final int remappedTechniqueCount;

    public CoverageSummary(int totalTactics, int totalTechniques, int techniquesWithAnyCoverage,
                           Map<String, SourceCoverage> sourceCoverage, List<String> unresolvableTechniques,
                           int remappedTechniqueCount) {
        this.totalTactics = totalTactics;
        this.totalTechniques = totalTechniques;
        this.techniquesWithAnyCoverage = techniquesWithAnyCoverage;
        this.overallCoveragePercent = percent(techniquesWithAnyCoverage, totalTechniques);
        this.sourceCoverage = Collections.unmodifiableMap(sourceCoverage);
        this.unresolvableTechniques = Collections.unmodifiableList(unresolvableTechniques);
        this.remappedTechniqueCount = remappedTechniqueCount;
    }

    /**
     * round(100 * covered / total), 0 when there is nothing to cover.
     */
    public static int percent(int covered, int total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.round(100.0 * covered / total);
    }

    public int getTotalTactics() {
        return totalTactics;
    }

    public int getTotalTechniques() {
        return totalTechniques;
    }

    public int getTechniquesWithAnyCoverage() {
        return techniquesWithAnyCoverage;
    }

    public int getOverallCoveragePercent() {
        return overallCoveragePercent;
    }

    public Map<String, SourceCoverage> getSourceCoverage() {
        return sourceCoverage;
    }

    public List<String> getUnresolvableTechniques() {
        return unresolvableTechniques;
    }

    @JsonProperty("unresolvable_count")
    public int getUnresolvableCount() {
        return unresolvableTechniques.size();
    }

    public int getRemappedTechniqueCount() {
        return remappedTechniqueCount;
    }

    /**
     * Coverage of a single source.
     */
    public static class SourceCoverage {

        @JsonProperty("covered_techniques")
        private final int coveredTechniques;

        @JsonProperty("total_techniques")
        private final int totalTechniques;

        @JsonProperty("coverage_percent")
        private final int coveragePercent;

        public SourceCoverage(int coveredTechniques, int totalTechniques) {
            this.coveredTechniques = coveredTechniques;
            this.totalTechniques = totalTechniques;
            this.coveragePercent = percent(coveredTechniques, totalTechniques);
        }

        public int getCoveredTechniques() {
            return coveredTechniques;
        }

        public int getTotalTechniques() {
            return totalTechniques;
        }

        public int getCoveragePercent() {
            return coveragePercent;
        }
    }
}
