package com.atlas.api;

import com.atlas.compare.RecordDiffService;
import com.atlas.compare.SourceComparisonService;
import com.atlas.coverage.CoverageMatrixBuilder;
import com.atlas.coverage.GapAnalysisService;
import com.atlas.domain.ComparisonResult;
import com.atlas.domain.CoverageMatrix;
import com.atlas.domain.DetectionSource;
import com.atlas.domain.DiffResult;
import com.atlas.domain.GapResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Cross-vendor comparison: lookups grouped by source, coverage gaps,
 * side-by-side diffs and the coverage matrix.
 */
@RestController
@RequestMapping("/api/compare")
public class CompareController {

    private final SourceComparisonService comparisonService;
    private final GapAnalysisService gapAnalysisService;
    private final RecordDiffService diffService;
    private final CoverageMatrixBuilder coverageMatrixBuilder;

    public CompareController(
        SourceComparisonService comparisonService,
        GapAnalysisService gapAnalysisService,
        RecordDiffService diffService,
        CoverageMatrixBuilder coverageMatrixBuilder
    ) {
        this.comparisonService = comparisonService;
        this.gapAnalysisService = gapAnalysisService;
        this.diffService = diffService;
        this.coverageMatrixBuilder = coverageMatrixBuilder;
    }

    @GetMapping
    public ComparisonResult compare(
        @RequestParam(required = false) String technique,
        @RequestParam(required = false) String keyword,
        @RequestParam(required = false) String platform,
        @RequestParam(required = false) String sources
    ) {
        return comparisonService.compareBy(technique, keyword, platform, RequestParams.sources(sources));
    }

    @GetMapping("/coverage-gap")
    public GapResult coverageGap(
        @RequestParam("base_source") String baseSource,
        @RequestParam("compare_source") String compareSource
    ) {
        return gapAnalysisService.gap(DetectionSource.parse(baseSource), DetectionSource.parse(compareSource));
    }

    @PostMapping("/side-by-side")
    public DiffResult sideBySide(@RequestBody SideBySideRequest request) {
        return diffService.diff(request.getIds());
    }

    @GetMapping("/coverage-matrix")
    public CoverageMatrix coverageMatrix(
        @RequestParam(required = false) String tactic,
        @RequestParam(required = false) String sources,
        @RequestParam(name = "include_subtechniques", defaultValue = "true") boolean includeSubtechniques
    ) {
        return coverageMatrixBuilder.build(RequestParams.sources(sources), includeSubtechniques, tactic);
    }

    public static class SideBySideRequest {

        @JsonProperty("ids")
        private List<String> ids = new ArrayList<>();

        public List<String> getIds() {
            return ids;
        }

        public void setIds(List<String> ids) {
            this.ids = ids;
        }
    }
}
