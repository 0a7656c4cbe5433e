package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Query parameters for the record search: free text, facet selections,
 * pagination and sorting.
 *
 * Facet lists are OR within a list and AND across lists; an empty list does
 * not constrain the result.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchFilters {

    public static final int DEFAULT_LIMIT = 50;
    public static final int UNLIMITED = Integer.MAX_VALUE;

    @JsonProperty("search")
    private String search;

    @JsonProperty("sources")
    private List<String> sources = new ArrayList<>();

    @JsonProperty("statuses")
    private List<String> statuses = new ArrayList<>();

    @JsonProperty("severities")
    private List<String> severities = new ArrayList<>();

    @JsonProperty("languages")
    private List<String> languages = new ArrayList<>();

    @JsonProperty("mitre_tactics")
    private List<String> mitreTactics = new ArrayList<>();

    @JsonProperty("mitre_techniques")
    private List<String> mitreTechniques = new ArrayList<>();

    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();

    @JsonProperty("log_sources")
    private List<String> logSources = new ArrayList<>();

    @JsonProperty("platforms")
    private List<String> platforms = new ArrayList<>();

    @JsonProperty("event_categories")
    private List<String> eventCategories = new ArrayList<>();

    @JsonProperty("data_sources_normalized")
    private List<String> dataSourcesNormalized = new ArrayList<>();

    @JsonProperty("offset")
    private int offset = 0;

    @JsonProperty("limit")
    private int limit = DEFAULT_LIMIT;

    @JsonProperty("sort_by")
    private String sortBy = "title";

    @JsonProperty("sort_order")
    private String sortOrder = "asc";

    public SearchFilters() {
    }

    /**
     * Copy of these filters with different pagination; used by export and by
     * the analytics that need every match.
     */
    public SearchFilters withPage(int newOffset, int newLimit) {
        SearchFilters copy = new SearchFilters();
        copy.search = search;
        copy.sources = new ArrayList<>(sources);
        copy.statuses = new ArrayList<>(statuses);
        copy.severities = new ArrayList<>(severities);
        copy.languages = new ArrayList<>(languages);
        copy.mitreTactics = new ArrayList<>(mitreTactics);
        copy.mitreTechniques = new ArrayList<>(mitreTechniques);
        copy.tags = new ArrayList<>(tags);
        copy.logSources = new ArrayList<>(logSources);
        copy.platforms = new ArrayList<>(platforms);
        copy.eventCategories = new ArrayList<>(eventCategories);
        copy.dataSourcesNormalized = new ArrayList<>(dataSourcesNormalized);
        copy.offset = newOffset;
        copy.limit = newLimit;
        copy.sortBy = sortBy;
        copy.sortOrder = sortOrder;
        return copy;
    }

    public SearchFilters unpaged() {
        return withPage(0, UNLIMITED);
    }

    // Getters and Setters

    public String getSearch() {
        return search;
    }

    public void setSearch(String search) {
        this.search = search;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = orEmpty(sources);
    }

    public List<String> getStatuses() {
        return statuses;
    }

    public void setStatuses(List<String> statuses) {
        this.statuses = orEmpty(statuses);
    }

    public List<String> getSeverities() {
        return severities;
    }

    public void setSeverities(List<String> severities) {
        this.severities = orEmpty(severities);
    }

    public List<String> getLanguages() {
        return languages;
    }

    public void setLanguages(List<String> languages) {
        this.languages = orEmpty(languages);
    }

    public List<String> getMitreTactics() {
        return mitreTactics;
    }

    public void setMitreTactics(List<String> mitreTactics) {
        this.mitreTactics = orEmpty(mitreTactics);
    }

    public List<String> getMitreTechniques() {
        return mitreTechniques;
    }

    public void setMitreTechniques(List<String> mitreTechniques) {
        this.mitreTechniques = orEmpty(mitreTechniques);
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = orEmpty(tags);
    }

    public List<String> getLogSources() {
        return logSources;
    }

    public void setLogSources(List<String> logSources) {
        this.logSources = orEmpty(logSources);
    }

    public List<String> getPlatforms() {
        return platforms;
    }

    public void setPlatforms(List<String> platforms) {
        this.platforms = orEmpty(platforms);
    }

    public List<String> getEventCategories() {
        return eventCategories;
    }

    public void setEventCategories(List<String> eventCategories) {
        this.eventCategories = orEmpty(eventCategories);
    }

    public List<String> getDataSourcesNormalized() {
        return dataSourcesNormalized;
    }

    public void setDataSourcesNormalized(List<String> dataSourcesNormalized) {
        this.dataSourcesNormalized = orEmpty(dataSourcesNormalized);
    }

    public int getOffset() {
        return offset;
    }

    public void setOffset(int offset) {
        this.offset = offset;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public String getSortBy() {
        return sortBy;
    }

    public void setSortBy(String sortBy) {
        this.sortBy = sortBy;
    }

    public String getSortOrder() {
        return sortOrder;
    }

    public void setSortOrder(String sortOrder) {
        this.sortOrder = sortOrder;
    }

    /**
     * Stable key of the matching criteria and ordering, pagination excluded.
     */
    public String criteriaKey() {
        return String.join("|",
            String.valueOf(search), sources.toString(), statuses.toString(), severities.toString(),
            languages.toString(), mitreTactics.toString(), mitreTechniques.toString(), tags.toString(),
            logSources.toString(), platforms.toString(), eventCategories.toString(),
            dataSourcesNormalized.toString(), String.valueOf(sortBy), String.valueOf(sortOrder));
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
