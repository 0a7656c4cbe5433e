package com.atlas.export;

import com.atlas.domain.DetectionRecord;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * RFC 4180 CSV with a header row. Set and list fields are flattened into one
 * cell joined with {@value #VALUE_SEPARATOR}; quoting of embedded commas,
 * quotes and line breaks is left to the CSV generator.
 */
public class CsvRecordWriter implements RecordWriter {

    public static final String VALUE_SEPARATOR = ";";

    static final List<String> COLUMNS = List.of(
        "id", "source", "language", "title", "description", "author", "status", "severity",
        "platform", "event_category", "data_source_normalized", "log_sources", "mitre_tactics",
        "mitre_techniques", "tags", "references", "rule_id", "rule_created_date", "rule_modified_date",
        "source_file", "source_rule_url", "updated_at");

    static final List<String> RAW_COLUMNS = List.of("detection_logic", "raw_content");

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
        .build();

    private final SequenceWriter rows;
    private final boolean includeRaw;

    public CsvRecordWriter(OutputStream out, boolean includeRaw) throws IOException {
        this.includeRaw = includeRaw;
        CsvSchema schema = CsvSchema.emptySchema().withLineSeparator("\r\n");
        this.rows = CSV_MAPPER.writerFor(String[].class).with(schema).writeValues(out);

        List<String> header = new ArrayList<>(COLUMNS);
        if (includeRaw) {
            header.addAll(RAW_COLUMNS);
        }
        rows.write(header.toArray(new String[0]));
    }

    @Override
    public void write(DetectionRecord record) throws IOException {
        List<String> row = new ArrayList<>(COLUMNS.size() + RAW_COLUMNS.size());
        row.add(record.getId());
        row.add(record.getSource().getValue());
        row.add(text(record.getLanguage()));
        row.add(text(record.getTitle()));
        row.add(text(record.getDescription()));
        row.add(text(record.getAuthor()));
        row.add(record.getStatus().getValue());
        row.add(record.getSeverity().getValue());
        row.add(text(record.getPlatform()));
        row.add(text(record.getEventCategory()));
        row.add(text(record.getDataSourceNormalized()));
        row.add(join(record.getLogSources()));
        row.add(join(record.getMitreTactics()));
        row.add(join(record.getMitreTechniques()));
        row.add(join(record.getTags()));
        row.add(join(record.getReferences()));
        row.add(text(record.getRuleId()));
        row.add(instant(record.getRuleCreatedDate()));
        row.add(instant(record.getRuleModifiedDate()));
        row.add(text(record.getSourceFile()));
        row.add(text(record.getSourceRuleUrl()));
        row.add(instant(record.getUpdatedAt()));
        if (includeRaw) {
            row.add(text(record.getDetectionLogic()));
            row.add(text(record.getRawContent()));
        }
        rows.write(row.toArray(new String[0]));
    }

    @Override
    public void finish() throws IOException {
        rows.close();
    }

    private static String text(String value) {
        return value != null ? value : "";
    }

    private static String instant(Instant value) {
        return value != null ? value.toString() : "";
    }

    private static String join(Collection<String> values) {
        return String.join(VALUE_SEPARATOR, values);
    }
}
