package com.atlas.export;

import com.atlas.domain.DetectionRecord;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.OutputStream;

/**
 * JSON array of records, written through the streaming generator.
 * Set fields stay native arrays.
 */
public class JsonRecordWriter implements RecordWriter {

    private final ObjectMapper objectMapper;
    private final JsonGenerator generator;
    private final boolean includeRaw;

    public JsonRecordWriter(ObjectMapper objectMapper, OutputStream out, boolean includeRaw) throws IOException {
        this.objectMapper = objectMapper;
        this.includeRaw = includeRaw;
        this.generator = objectMapper.createGenerator(out, JsonEncoding.UTF8);
        this.generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        this.generator.writeStartArray();
    }

    @Override
    public void write(DetectionRecord record) throws IOException {
        ObjectNode node = objectMapper.valueToTree(record);
        if (!includeRaw) {
            node.remove("raw_content");
            node.remove("detection_logic");
        }
        generator.writeTree(node);
    }

    @Override
    public void finish() throws IOException {
        generator.writeEndArray();
        generator.close();
    }
}
