package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Aggregate counts over the current record snapshot.
 */
public class RecordStatistics {

    @JsonProperty("total")
    private final int total;

    @JsonProperty("by_source")
    private final Map<String, Integer> bySource;

    @JsonProperty("by_severity")
    private final Map<String, Integer> bySeverity;

    @JsonProperty("by_status")
    private final Map<String, Integer> byStatus;

    @JsonProperty("top_techniques")
    private final List<CountEntry> topTechniques;

    @JsonProperty("top_tactics")
    private final List<CountEntry> topTactics;

    public RecordStatistics(int total, Map<String, Integer> bySource, Map<String, Integer> bySeverity,
                            Map<String, Integer> byStatus, List<CountEntry> topTechniques,
                            List<CountEntry> topTactics) {
        this.total = total;
        this.bySource = bySource;
        this.bySeverity = bySeverity;
        this.byStatus = byStatus;
        this.topTechniques = topTechniques;
        this.topTactics = topTactics;
    }

    public int getTotal() {
        return total;
    }

    public Map<String, Integer> getBySource() {
        return bySource;
    }

    public Map<String, Integer> getBySeverity() {
        return bySeverity;
    }

    public Map<String, Integer> getByStatus() {
        return byStatus;
    }

    public List<CountEntry> getTopTechniques() {
        return topTechniques;
    }

    public List<CountEntry> getTopTactics() {
        return topTactics;
    }

    /**
     * An id with its record count.
     */
    public static class CountEntry {

        @JsonProperty("id")
        private final String id;

        @JsonProperty("count")
        private final int count;

        public CountEntry(String id, int count) {
            this.id = id;
            this.count = count;
        }

        public String getId() {
            return id;
        }

        public int getCount() {
            return count;
        }
    }
}
