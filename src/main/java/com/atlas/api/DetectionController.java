package com.atlas.api;

import com.atlas.domain.DetectionRecord;
import com.atlas.domain.RecordStatistics;
import com.atlas.domain.SearchFilters;
import com.atlas.domain.SearchResult;
import com.atlas.search.SearchService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Record listing, search and detail endpoints.
 */
@RestController
@RequestMapping("/api/detections")
public class DetectionController {

    private final SearchService searchService;
    private final int maxPageSize;

    public DetectionController(
        SearchService searchService,
        @Value("${atlas.search.max-page-size:200}") int maxPageSize
    ) {
        this.searchService = searchService;
        this.maxPageSize = maxPageSize;
    }

    @GetMapping
    public SearchResult list(
        @RequestParam(required = false) String search,
        @RequestParam(required = false) String sources,
        @RequestParam(required = false) String statuses,
        @RequestParam(required = false) String severities,
        @RequestParam(required = false) String languages,
        @RequestParam(name = "mitre_tactics", required = false) String mitreTactics,
        @RequestParam(name = "mitre_techniques", required = false) String mitreTechniques,
        @RequestParam(required = false) String tags,
        @RequestParam(name = "log_sources", required = false) String logSources,
        @RequestParam(required = false) String platforms,
        @RequestParam(name = "event_categories", required = false) String eventCategories,
        @RequestParam(name = "data_sources_normalized", required = false) String dataSourcesNormalized,
        @RequestParam(defaultValue = "0") int offset,
        @RequestParam(defaultValue = "50") int limit,
        @RequestParam(name = "sort_by", defaultValue = "title") String sortBy,
        @RequestParam(name = "sort_order", defaultValue = "asc") String sortOrder
    ) {
        SearchFilters filters = new SearchFilters();
        filters.setSearch(search);
        filters.setSources(RequestParams.split(sources));
        filters.setStatuses(RequestParams.split(statuses));
        filters.setSeverities(RequestParams.split(severities));
        filters.setLanguages(RequestParams.split(languages));
        filters.setMitreTactics(RequestParams.split(mitreTactics));
        filters.setMitreTechniques(RequestParams.split(mitreTechniques));
        filters.setTags(RequestParams.split(tags));
        filters.setLogSources(RequestParams.split(logSources));
        filters.setPlatforms(RequestParams.split(platforms));
        filters.setEventCategories(RequestParams.split(eventCategories));
        filters.setDataSourcesNormalized(RequestParams.split(dataSourcesNormalized));
        filters.setOffset(Math.max(0, offset));
        filters.setLimit(RequestParams.clamp(limit, 1, maxPageSize));
        filters.setSortBy(sortBy);
        filters.setSortOrder(sortOrder);
        return searchService.search(filters);
    }

    @PostMapping("/search")
    public SearchResult search(@RequestBody SearchFilters filters) {
        SearchFilters page = filters.withPage(
            Math.max(0, filters.getOffset()),
            RequestParams.clamp(filters.getLimit(), 1, maxPageSize));
        return searchService.search(page);
    }

    @GetMapping("/statistics")
    public RecordStatistics statistics() {
        return searchService.statistics();
    }

    @GetMapping("/filters")
    public Map<String, List<String>> filterOptions() {
        return searchService.filterOptions();
    }

    @GetMapping("/{id}")
    public DetectionRecord getDetection(@PathVariable String id) {
        return searchService.getRecord(id);
    }
}
