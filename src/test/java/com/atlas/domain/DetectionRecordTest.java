package com.atlas.domain;

import com.atlas.TestData;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionRecordTest {

    private final ObjectMapper objectMapper = TestData.objectMapper();

    @Test
    void testBuild_BlankId_ShouldFail() {
        assertThatThrownBy(() -> DetectionRecord.builder().id(" ").build())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testBuild_Defaults_ShouldBeFilled() {
        DetectionRecord record = DetectionRecord.builder().id("r1").build();

        assertThat(record.getSource()).isEqualTo(DetectionSource.OTHER);
        assertThat(record.getSeverity()).isEqualTo(Severity.UNKNOWN);
        assertThat(record.getStatus()).isEqualTo(RuleStatus.UNKNOWN);
        assertThat(record.getLanguage()).isEqualTo("unknown");
        assertThat(record.getMitreTechniques()).isEmpty();
        assertThat(record.getPlatform()).isEmpty();
    }

    @Test
    void testBuild_SetFields_ShouldDropBlankEntriesAndDuplicates() {
        DetectionRecord record = DetectionRecord.builder()
            .id("r1")
            .mitreTechniques(Arrays.asList("T1059", null, "", "T1059", "T1055"))
            .build();

        assertThat(record.getMitreTechniques()).containsExactly("T1059", "T1055");
    }

    @Test
    void testJson_ShouldUseSnakeCaseNames() throws Exception {
        DetectionRecord record = TestData.recordBuilder("r1", DetectionSource.ELASTIC_HUNTING)
            .mitreTechniques(List.of("T1055"))
            .dataSourceNormalized("process_creation")
            .severity(Severity.CRITICAL)
            .build();

        String json = objectMapper.writeValueAsString(record);

        assertThat(json).contains("\"source\":\"elastic_hunting\"")
            .contains("\"mitre_techniques\":[\"T1055\"]")
            .contains("\"data_source_normalized\":\"process_creation\"")
            .contains("\"severity\":\"critical\"");
        assertThat(objectMapper.readValue(json, DetectionRecord.class)).isEqualTo(record);
    }

    @Test
    void testSourceParse_UnknownValue_ShouldFailStrictly() {
        assertThat(DetectionSource.fromValue("chronicle")).isEqualTo(DetectionSource.OTHER);
        assertThatThrownBy(() -> DetectionSource.parse("chronicle"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
