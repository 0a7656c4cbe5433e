package com.atlas.api;

import com.atlas.TestData;
import com.atlas.domain.DetectionSource;
import com.atlas.export.ExportService;
import com.atlas.metrics.AnalysisMetrics;
import com.atlas.search.SearchService;
import com.atlas.store.DetectionRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ExportControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        DetectionRecordStore store = new DetectionRecordStore();
        store.publish(List.of(
            TestData.recordBuilder("sigma-001", DetectionSource.SIGMA).title("PowerShell download")
                .mitreTechniques(List.of("T1059.001")).build(),
            TestData.recordBuilder("splunk-001", DetectionSource.SPLUNK).title("Process injection")
                .mitreTechniques(List.of("T1055")).build()));
        AnalysisMetrics metrics = new AnalysisMetrics(new SimpleMeterRegistry());
        ExportService exportService = new ExportService(store, new SearchService(store, metrics),
            TestData.objectMapper(), metrics);

        mockMvc = MockMvcBuilders.standaloneSetup(new ExportController(exportService))
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void testExport_NoSelection_ShouldReturn400BeforeStreaming() throws Exception {
        mockMvc.perform(post("/api/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"format\":\"csv\"}"))
            .andExpect(request().asyncNotStarted())
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.detail").value("Export requires either 'ids' or 'filters'"));
    }

    @Test
    void testExport_CsvByIds_ShouldStreamDownload() throws Exception {
        // Given: An id selection in CSV
        MvcResult result = mockMvc.perform(post("/api/export")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"format\":\"csv\",\"ids\":[\"splunk-001\"]}"))
            .andExpect(request().asyncStarted())
            .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                "attachment; filename=detections_export.csv"))
            .andReturn();

        // When / Then: The streamed body holds the header row and only the selected record
        mockMvc.perform(asyncDispatch(result))
            .andExpect(status().isOk())
            .andExpect(content().string(containsString("id,source,language,title")))
            .andExpect(content().string(containsString("splunk-001,splunk")))
            .andExpect(content().string(not(containsString("sigma-001"))));
    }
}
