package com.atlas.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * One page of search results; {@code total} counts every match before pagination.
 */
public class SearchResult {

    @JsonProperty("items")
    private final List<DetectionRecord> items;

    @JsonProperty("total")
    private final int total;

    @JsonProperty("offset")
    private final int offset;

    @JsonProperty("limit")
    private final int limit;

    public SearchResult(List<DetectionRecord> items, int total, int offset, int limit) {
        this.items = items != null ? Collections.unmodifiableList(items) : Collections.emptyList();
        this.total = total;
        this.offset = offset;
        this.limit = limit;
    }

    public List<DetectionRecord> getItems() {
        return items;
    }

    public int getTotal() {
        return total;
    }

    public int getOffset() {
        return offset;
    }

    public int getLimit() {
        return limit;
    }

    @JsonProperty("has_more")
    public boolean isHasMore() {
        return (long) offset + items.size() < total;
    }
}
