package com.atlas.compare;

import com.atlas.TestData;
import com.atlas.domain.ComparisonResult;
import com.atlas.domain.DetectionRecord;
import com.atlas.domain.DetectionSource;
import com.atlas.exception.InvalidSelectionException;
import com.atlas.store.DetectionRecordStore;
import com.atlas.taxonomy.TaxonomyProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.atlas.TestData.recordBuilder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceComparisonServiceTest {

    @Mock
    private TaxonomyProvider taxonomyProvider;

    private SourceComparisonService comparisonService;

    @BeforeEach
    void setUp() {
        DetectionRecordStore store = new DetectionRecordStore();
        comparisonService = new SourceComparisonService(store, taxonomyProvider);

        store.publish(List.of(
            recordBuilder("s1", DetectionSource.SIGMA).title("B rule")
                .mitreTechniques(List.of("T1059.001")).platform("windows")
                .detectionLogic("EventID: 4688").build(),
            recordBuilder("s2", DetectionSource.SIGMA).title("A rule")
                .mitreTechniques(List.of("T1064")).platform("linux").build(),
            recordBuilder("e1", DetectionSource.ELASTIC).title("Elastic rule")
                .mitreTechniques(List.of("T1059")).platform("Windows")
                .rawContent("event.code: \"4688\"").build(),
            recordBuilder("k1", DetectionSource.SPLUNK).title("Splunk rule")
                .mitreTechniques(List.of("T1055")).platform("aws").build()));
    }

    @Test
    void testCompareByTechnique_ShouldIncludeSubtechniquesAndRemappedIds() {
        when(taxonomyProvider.current()).thenReturn(TestData.taxonomy());

        ComparisonResult result = comparisonService.compareBy("T1059", null, null, List.of());

        assertThat(result.getQueryType()).isEqualTo("technique");
        assertThat(result.getResults().keySet()).containsExactly("elastic", "sigma");
        assertThat(result.getResults().get("sigma")).extracting(DetectionRecord::getId).containsExactly("s2", "s1");
        assertThat(result.getTotalBySource()).containsEntry("sigma", 2).containsEntry("elastic", 1);
    }

    @Test
    void testCompareByTechnique_UnknownSubtechniqueId_ShouldNotMatchParent() {
        // Given: A rule citing a sub-technique id the taxonomy does not know
        DetectionRecordStore store = new DetectionRecordStore();
        store.publish(List.of(
            recordBuilder("s9", DetectionSource.SIGMA).mitreTechniques(List.of("T1059.999")).build(),
            recordBuilder("s1", DetectionSource.SIGMA).mitreTechniques(List.of("T1059.001")).build()));
        when(taxonomyProvider.current()).thenReturn(TestData.taxonomy());

        // When
        ComparisonResult result = new SourceComparisonService(store, taxonomyProvider)
            .compareBy("T1059", null, null, List.of());

        // Then: Only known sub-techniques of T1059 match
        assertThat(result.getResults().get("sigma")).extracting(DetectionRecord::getId).containsExactly("s1");
    }

    @Test
    void testCompareByKeyword_ShouldSearchLogicAndRawContent() {
        ComparisonResult result = comparisonService.compareBy(null, "4688", null, null);

        assertThat(result.getQueryType()).isEqualTo("keyword");
        assertThat(result.getTotalBySource()).containsOnlyKeys("sigma", "elastic");
    }

    @Test
    void testCompareByPlatform_WithSourceFilter() {
        ComparisonResult result = comparisonService.compareBy(null, null, "WINDOWS", List.of(DetectionSource.ELASTIC));

        assertThat(result.getQueryType()).isEqualTo("platform");
        assertThat(result.getResults()).containsOnlyKeys("elastic");
    }

    @Test
    void testCompareBy_NoCriterion_ShouldThrowInvalidSelection() {
        assertThatThrownBy(() -> comparisonService.compareBy(" ", null, "", null))
            .isInstanceOf(InvalidSelectionException.class);
    }
}
