package com.atlas.search;

import com.atlas.domain.DetectionRecord;
import com.atlas.domain.DetectionSource;
import com.atlas.domain.RecordStatistics;
import com.atlas.domain.RuleStatus;
import com.atlas.domain.SearchFilters;
import com.atlas.domain.SearchResult;
import com.atlas.domain.Severity;
import com.atlas.exception.RecordNotFoundException;
import com.atlas.metrics.AnalysisMetrics;
import com.atlas.store.DetectionRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.atlas.TestData.recordBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchServiceTest {

    private DetectionRecordStore store;
    private AnalysisMetrics metrics;
    private SearchService searchService;

    @BeforeEach
    void setUp() {
        store = new DetectionRecordStore();
        metrics = new AnalysisMetrics(new SimpleMeterRegistry());
        searchService = new SearchService(store, metrics);

        store.publish(List.of(
            recordBuilder("s1", DetectionSource.SIGMA)
                .title("PowerShell Encoded Command")
                .severity(Severity.HIGH)
                .status(RuleStatus.STABLE)
                .author("Florian Roth")
                .mitreTactics(List.of("execution"))
                .mitreTechniques(List.of("T1059.001"))
                .tags(List.of("attack.execution"))
                .platform("windows")
                .ruleCreatedDate(Instant.parse("2022-01-01T00:00:00Z"))
                .build(),
            recordBuilder("s2", DetectionSource.SIGMA)
                .title("Linux Reverse Shell")
                .severity(Severity.MEDIUM)
                .status(RuleStatus.EXPERIMENTAL)
                .detectionLogic("bash -i >& /dev/tcp/")
                .mitreTechniques(List.of("T1059.004"))
                .platform("linux")
                .build(),
            recordBuilder("e1", DetectionSource.ELASTIC)
                .title("Process Injection")
                .severity(Severity.CRITICAL)
                .status(RuleStatus.STABLE)
                .mitreTechniques(List.of("T1055"))
                .platform("Windows")
                .ruleCreatedDate(Instant.parse("2020-06-01T00:00:00Z"))
                .build(),
            recordBuilder("k1", DetectionSource.SPLUNK)
                .title("Anomalous Logon")
                .severity(Severity.LOW)
                .description("Unusual powershell remoting logon")
                .platform("windows")
                .build()));
    }

    private static SearchFilters filters() {
        return new SearchFilters();
    }

    @Test
    void testSearch_NoFilters_ShouldReturnAllSortedByTitle() {
        SearchResult result = searchService.search(filters());

        assertThat(result.getTotal()).isEqualTo(4);
        assertThat(result.getItems()).extracting(DetectionRecord::getId).containsExactly("k1", "s2", "e1", "s1");
    }

    @Test
    void testSearch_TotalShouldMatchUnlimitedQuery() {
        // Given: A filter matching three records, requested one per page
        SearchFilters paged = filters();
        paged.setPlatforms(List.of("windows"));
        paged.setLimit(1);

        // When: Querying paged and unlimited
        SearchResult page = searchService.search(paged);
        SearchResult all = searchService.search(paged.unpaged());

        // Then: The paged total equals the unlimited item count
        assertThat(page.getItems()).hasSize(1);
        assertThat(page.getTotal()).isEqualTo(all.getItems().size()).isEqualTo(3);
        assertThat(page.isHasMore()).isTrue();
    }

    @Test
    void testSearch_OffsetBeyondTotal_ShouldReturnEmptyPage() {
        SearchResult result = searchService.search(filters().withPage(10, 5));

        assertThat(result.getItems()).isEmpty();
        assertThat(result.getTotal()).isEqualTo(4);
    }

    @Test
    @DisplayName("Facet values are OR within a facet and AND across facets")
    void testSearch_Facets_ShouldCombineOrWithinAndAcross() {
        SearchFilters within = filters();
        within.setSources(List.of("sigma", "elastic"));

        SearchFilters across = filters();
        across.setSources(List.of("sigma", "elastic"));
        across.setStatuses(List.of("stable"));

        assertThat(searchService.search(within).getItems())
            .extracting(DetectionRecord::getId).containsExactlyInAnyOrder("s1", "s2", "e1");
        assertThat(searchService.search(across).getItems())
            .extracting(DetectionRecord::getId).containsExactlyInAnyOrder("s1", "e1");
    }

    @Test
    void testSearch_StringFacets_ShouldIgnoreCase() {
        SearchFilters query = filters();
        query.setPlatforms(List.of("WINDOWS"));
        query.setSources(List.of("Elastic"));

        assertThat(searchService.search(query).getItems()).extracting(DetectionRecord::getId).containsExactly("e1");
    }

    @Test
    void testSearch_TechniqueFacet_ShouldTestIntersection() {
        SearchFilters query = filters();
        query.setMitreTechniques(List.of("T1055", "T1059.004"));

        assertThat(searchService.search(query).getItems())
            .extracting(DetectionRecord::getId).containsExactlyInAnyOrder("s2", "e1");
    }

    @Test
    void testSearch_FreeText_ShouldMatchSubstringAcrossFields() {
        SearchFilters query = filters();
        query.setSearch("PowerShell");

        SearchFilters logic = filters();
        logic.setSearch("/dev/tcp");

        SearchFilters author = filters();
        author.setSearch("roth");

        assertThat(searchService.search(query).getItems())
            .extracting(DetectionRecord::getId).containsExactlyInAnyOrder("s1", "k1");
        assertThat(searchService.search(logic).getItems()).extracting(DetectionRecord::getId).containsExactly("s2");
        assertThat(searchService.search(author).getItems()).extracting(DetectionRecord::getId).containsExactly("s1");
    }

    @Test
    void testSearch_SortBySeverity_ShouldUseRankNotAlphabet() {
        SearchFilters query = filters();
        query.setSortBy("severity");
        query.setSortOrder("desc");

        assertThat(searchService.search(query).getItems())
            .extracting(DetectionRecord::getSeverity)
            .containsExactly(Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW);
    }

    @Test
    void testSearch_SortByDate_ShouldPlaceNullsLastInBothDirections() {
        SearchFilters ascending = filters();
        ascending.setSortBy("rule_created_date");
        SearchFilters descending = filters();
        descending.setSortBy("rule_created_date");
        descending.setSortOrder("desc");

        assertThat(searchService.search(ascending).getItems())
            .extracting(DetectionRecord::getId).containsExactly("e1", "s1", "k1", "s2");
        assertThat(searchService.search(descending).getItems())
            .extracting(DetectionRecord::getId).containsExactly("s1", "e1", "k1", "s2");
    }

    @Test
    void testSearch_UnknownSortField_ShouldFallBackToTitle() {
        SearchFilters query = filters();
        query.setSortBy("popularity");
        query.setSortOrder("desc");

        SearchResult result = searchService.search(query);

        assertThat(result.getItems()).extracting(DetectionRecord::getId).containsExactly("k1", "s2", "e1", "s1");
        assertThat(metrics.getSortFallbacks().count()).isEqualTo(1.0);
    }

    @Test
    void testGetRecord_UnknownId_ShouldThrowNotFound() {
        assertThat(searchService.getRecord("s1").getTitle()).isEqualTo("PowerShell Encoded Command");
        assertThatThrownBy(() -> searchService.getRecord("missing"))
            .isInstanceOf(RecordNotFoundException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void testFindByIds_ShouldKeepRequestOrderAndSkipUnknown() {
        List<DetectionRecord> found = searchService.findByIds(store.snapshot(), List.of("e1", "nope", "s1"));

        assertThat(found).extracting(DetectionRecord::getId).containsExactly("e1", "s1");
    }

    @Test
    void testStatistics_ShouldCountBySourceSeverityAndStatus() {
        RecordStatistics statistics = searchService.statistics();

        assertThat(statistics.getTotal()).isEqualTo(4);
        assertThat(statistics.getBySource()).containsEntry("sigma", 2).containsEntry("elastic", 1);
        assertThat(statistics.getBySeverity()).containsEntry("critical", 1).containsEntry("unknown", 0);
        assertThat(statistics.getByStatus()).containsEntry("stable", 2).containsEntry("unknown", 1);
        assertThat(statistics.getTopTechniques()).extracting(RecordStatistics.CountEntry::getId)
            .containsExactly("T1055", "T1059.001", "T1059.004");
    }

    @Test
    void testFilterOptions_ShouldListDistinctValues() {
        Map<String, List<String>> options = searchService.filterOptions();

        assertThat(options.get("platforms")).containsExactly("Windows", "linux", "windows");
        assertThat(options.get("severities")).contains("critical", "unknown");
        assertThat(options.get("mitre_techniques")).containsExactly("T1055", "T1059.001", "T1059.004");
    }
}
