package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;

/**
 * Detection counts of one technique, per source and in total.
 *
 * {@code canonical} is false when the technique is listed under the tactic
 * only because rule metadata placed it there.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TechniqueCoverage {

    @JsonProperty("id")
    private final String id;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("is_subtechnique")
    private final boolean subtechnique;

    @JsonProperty("parent_id")
    private final String parentId;

    @JsonProperty("coverage")
    private final Map<String, Integer> coverage;

    @JsonProperty("total_detections")
    private final int totalDetections;

    @JsonProperty("canonical")
    private final boolean canonical;

    public TechniqueCoverage(Technique technique, Map<String, Integer> coverage, int totalDetections,
                             boolean canonical) {
        this.id = technique.getId();
        this.name = technique.getName();
        this.subtechnique = technique.isSubtechnique();
        this.parentId = technique.getParentId();
        this.coverage = Collections.unmodifiableMap(coverage);
        this.totalDetections = totalDetections;
        this.canonical = canonical;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isSubtechnique() {
        return subtechnique;
    }

    public String getParentId() {
        return parentId;
    }

    public Map<String, Integer> getCoverage() {
        return coverage;
    }

    public int getTotalDetections() {
        return totalDetections;
    }

    public boolean isCanonical() {
        return canonical;
    }

    public boolean isCovered() {
        return totalDetections > 0;
    }

    @JsonProperty("sources_with_coverage")
    public int getSourcesWithCoverage() {
        int count = 0;
        for (Integer value : coverage.values()) {
            if (value != null && value > 0) {
                count++;
            }
        }
        return count;
    }
}
