package com.atlas.api;

import com.atlas.compare.RecordDiffService;
import com.atlas.compare.SourceComparisonService;
import com.atlas.coverage.CoverageMatrixBuilder;
import com.atlas.coverage.GapAnalysisService;
import com.atlas.domain.DetectionSource;
import com.atlas.exception.InvalidSelectionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CompareControllerTest {

    @Mock
    private SourceComparisonService comparisonService;

    @Mock
    private GapAnalysisService gapAnalysisService;

    @Mock
    private RecordDiffService diffService;

    @Mock
    private CoverageMatrixBuilder coverageMatrixBuilder;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        CompareController controller = new CompareController(
            comparisonService, gapAnalysisService, diffService, coverageMatrixBuilder);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void testSideBySide_SingleId_ShouldReturn400() throws Exception {
        // Given
        when(diffService.diff(List.of("sigma-001")))
            .thenThrow(new InvalidSelectionException("Must provide 2-6 detection IDs for comparison", 1));

        // When / Then
        mockMvc.perform(post("/api/compare/side-by-side")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"ids\":[\"sigma-001\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("Must provide 2-6 detection IDs for comparison [Selected: 1]"));
    }

    @Test
    void testCoverageGap_UnknownSource_ShouldReturn400() throws Exception {
        mockMvc.perform(get("/api/compare/coverage-gap")
                .param("base_source", "sigma")
                .param("compare_source", "nonexistent"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(gapAnalysisService);
    }

    @Test
    void testCoverageGap_MissingParameter_ShouldReturn400() throws Exception {
        mockMvc.perform(get("/api/compare/coverage-gap").param("base_source", "sigma"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testCoverageGap_ShouldParseSources() throws Exception {
        mockMvc.perform(get("/api/compare/coverage-gap")
                .param("base_source", "sigma")
                .param("compare_source", "elastic"))
            .andExpect(status().isOk());

        verify(gapAnalysisService).gap(DetectionSource.SIGMA, DetectionSource.ELASTIC);
    }

    @Test
    void testCoverageMatrix_ShouldPassOptions() throws Exception {
        mockMvc.perform(get("/api/compare/coverage-matrix")
                .param("sources", "sigma,splunk")
                .param("tactic", "TA0002")
                .param("include_subtechniques", "false"))
            .andExpect(status().isOk());

        verify(coverageMatrixBuilder).build(
            List.of(DetectionSource.SIGMA, DetectionSource.SPLUNK), false, "TA0002");
    }

    @Test
    void testCoverageMatrix_UnknownTactic_ShouldReturn400() throws Exception {
        when(coverageMatrixBuilder.build(any(), anyBoolean(), any()))
            .thenThrow(new InvalidSelectionException("Invalid tactic ID: TA9999"));

        mockMvc.perform(get("/api/compare/coverage-matrix").param("tactic", "TA9999"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("Invalid tactic ID: TA9999"));
    }
}
