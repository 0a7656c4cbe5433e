package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * One tactic column of the coverage matrix.
 */
public class TacticCoverage {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("short_name")
    private final String shortName;

    @JsonProperty("techniques")
    private final List<TechniqueCoverage> techniques;

    public TacticCoverage(Tactic tactic, List<TechniqueCoverage> techniques) {
        this.id = tactic.getId();
        this.name = tactic.getName();
        this.shortName = tactic.getShortName();
        this.techniques = Collections.unmodifiableList(techniques);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getShortName() {
        return shortName;
    }

    public List<TechniqueCoverage> getTechniques() {
        return techniques;
    }

    @JsonProperty("technique_count")
    public int getTechniqueCount() {
        return techniques.size();
    }
}
