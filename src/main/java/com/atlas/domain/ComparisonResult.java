package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Records matching one technique, keyword or platform, grouped by source.
 */
public class ComparisonResult {

    @JsonProperty("query_type")
    private final String queryType;

    @JsonProperty("query_value")
    private final String queryValue;

    @JsonProperty("results")
    private final Map<String, List<DetectionRecord>> results;

    @JsonProperty("total_by_source")
    private final Map<String, Integer> totalBySource;

    public ComparisonResult(String queryType, String queryValue, Map<String, List<DetectionRecord>> results,
                            Map<String, Integer> totalBySource) {
        this.queryType = queryType;
        this.queryValue = queryValue;
        this.results = Collections.unmodifiableMap(results);
        this.totalBySource = Collections.unmodifiableMap(totalBySource);
    }

    public String getQueryType() {
        return queryType;
    }

    public String getQueryValue() {
        return queryValue;
    }

    public Map<String, List<DetectionRecord>> getResults() {
        return results;
    }

    public Map<String, Integer> getTotalBySource() {
        return totalBySource;
    }
}
