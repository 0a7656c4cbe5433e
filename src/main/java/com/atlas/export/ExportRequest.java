package com.atlas.export;

import com.atlas.domain.SearchFilters;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Export selection: explicit ids, or a filter whose every match is exported.
 * Non-empty ids take precedence over the filter.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExportRequest {

    @JsonProperty("format")
    private ExportFormat format = ExportFormat.JSON;

    @JsonProperty("filters")
    private SearchFilters filters;

    @JsonProperty("ids")
    private List<String> ids = new ArrayList<>();

    @JsonProperty("include_raw")
    private boolean includeRaw;

    public ExportRequest() {
    }

    public ExportRequest(ExportFormat format, SearchFilters filters, List<String> ids, boolean includeRaw) {
        this.format = format;
        this.filters = filters;
        setIds(ids);
        this.includeRaw = includeRaw;
    }

    public ExportFormat getFormat() {
        return format;
    }

    public void setFormat(ExportFormat format) {
        this.format = format != null ? format : ExportFormat.JSON;
    }

    public SearchFilters getFilters() {
        return filters;
    }

    public void setFilters(SearchFilters filters) {
        this.filters = filters;
    }

    public List<String> getIds() {
        return ids;
    }

    public void setIds(List<String> ids) {
        this.ids = ids != null ? new ArrayList<>(ids) : new ArrayList<>();
    }

    public boolean isIncludeRaw() {
        return includeRaw;
    }

    public void setIncludeRaw(boolean includeRaw) {
        this.includeRaw = includeRaw;
    }
}
