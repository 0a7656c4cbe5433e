package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Tactic x technique x source detection counts with a coverage summary.
 * Derived per request from the record and taxonomy snapshots; never stored.
 */
public class CoverageMatrix {

    @JsonProperty("sources")
    private final List<String> sources;

    @JsonProperty("tactics")
    private final List<TacticCoverage> tactics;

    @JsonProperty("summary")
    private final CoverageSummary summary;

    public CoverageMatrix(List<String> sources, List<TacticCoverage> tactics, CoverageSummary summary) {
        this.sources = Collections.unmodifiableList(sources);
        this.tactics = Collections.unmodifiableList(tactics);
        this.summary = summary;
    }

    public List<String> getSources() {
        return sources;
    }

    public List<TacticCoverage> getTactics() {
        return tactics;
    }

    public CoverageSummary getSummary() {
        return summary;
    }
}
