package com.atlas.coverage;

import com.atlas.TestData;
import com.atlas.domain.DetectionSource;
import com.atlas.domain.GapResult;
import com.atlas.metrics.AnalysisMetrics;
import com.atlas.store.DetectionRecordStore;
import com.atlas.taxonomy.TaxonomyIndex;
import com.atlas.taxonomy.TaxonomyProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.atlas.TestData.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GapAnalysisServiceTest {

    @Mock
    private TaxonomyProvider taxonomyProvider;

    private DetectionRecordStore store;
    private AnalysisMetrics metrics;
    private GapAnalysisService gapAnalysisService;

    @BeforeEach
    void setUp() {
        store = new DetectionRecordStore();
        metrics = new AnalysisMetrics(new SimpleMeterRegistry());
        gapAnalysisService = new GapAnalysisService(store, taxonomyProvider, metrics);
    }

    @Test
    void testGap_DisjointSources_ShouldSplitTechniques() {
        // Given: One sigma rule on T1059 and one elastic rule on T1055, no taxonomy loaded
        when(taxonomyProvider.current()).thenReturn(TaxonomyIndex.empty());
        store.publish(List.of(
            record("r1", DetectionSource.SIGMA, "T1059"),
            record("r2", DetectionSource.ELASTIC, "T1055")));

        // When: Comparing sigma against elastic
        GapResult result = gapAnalysisService.gap(DetectionSource.SIGMA, DetectionSource.ELASTIC);

        // Then: Each side's technique is a gap of the other
        assertThat(result.getGaps()).containsExactly("T1059");
        assertThat(result.getUniqueToCompare()).containsExactly("T1055");
        assertThat(result.getOverlapCount()).isZero();
        assertThat(result.getBaseTechniqueCount()).isEqualTo(1);
        assertThat(result.getCompareTechniqueCount()).isEqualTo(1);
    }

    @Test
    void testGap_SwappedArguments_ShouldSwapResultSets() {
        when(taxonomyProvider.current()).thenReturn(TestData.taxonomy());
        store.publish(List.of(
            record("r1", DetectionSource.SIGMA, "T1059", "T1055"),
            record("r2", DetectionSource.SIGMA, "T1059.001"),
            record("r3", DetectionSource.SPLUNK, "T1055", "T1055.012"),
            record("r4", DetectionSource.SPLUNK, "T4242")));

        GapResult forward = gapAnalysisService.gap(DetectionSource.SIGMA, DetectionSource.SPLUNK);
        GapResult backward = gapAnalysisService.gap(DetectionSource.SPLUNK, DetectionSource.SIGMA);

        assertThat(forward.getGaps()).containsExactly("T1059", "T1059.001");
        assertThat(forward.getUniqueToCompare()).containsExactly("T1055.012", "T4242");
        assertThat(forward.getGaps()).isEqualTo(backward.getUniqueToCompare());
        assertThat(forward.getUniqueToCompare()).isEqualTo(backward.getGaps());
        assertThat(forward.getOverlapCount()).isEqualTo(backward.getOverlapCount()).isEqualTo(1);
    }

    @Test
    void testGap_DeprecatedId_ShouldOverlapItsReplacement() {
        // Given: Sigma still tags the revoked T1064, elastic uses its replacement
        when(taxonomyProvider.current()).thenReturn(TestData.taxonomy());
        store.publish(List.of(
            record("r1", DetectionSource.SIGMA, "T1064"),
            record("r2", DetectionSource.ELASTIC, "T1059")));

        // When: Comparing the two
        GapResult result = gapAnalysisService.gap(DetectionSource.SIGMA, DetectionSource.ELASTIC);

        // Then: No spurious gap appears
        assertThat(result.getGaps()).isEmpty();
        assertThat(result.getUniqueToCompare()).isEmpty();
        assertThat(result.getOverlapCount()).isEqualTo(1);
    }

    @Test
    void testGap_UnresolvableIds_ShouldBeReported() {
        when(taxonomyProvider.current()).thenReturn(TestData.taxonomy());
        store.publish(List.of(
            record("r1", DetectionSource.SIGMA, "T4242"),
            record("r2", DetectionSource.ELASTIC, "T1059")));

        GapResult result = gapAnalysisService.gap(DetectionSource.SIGMA, DetectionSource.ELASTIC);

        assertThat(result.getUnresolvableTechniques()).containsExactly("T4242");
        assertThat(result.getGaps()).containsExactly("T4242");
        assertThat(metrics.getUnresolvableTechniques().count()).isEqualTo(1.0);
    }
}
