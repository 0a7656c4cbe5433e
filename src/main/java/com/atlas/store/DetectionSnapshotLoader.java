package com.atlas.store;

import com.atlas.domain.DetectionRecord;
import com.atlas.domain.DetectionSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads the record set written by the ingestion pipeline and publishes it to
 * the {@link DetectionRecordStore}.
 *
 * The file is a JSON (or YAML, by extension) array of detection records, or an
 * object with an {@code items} array. Each entry is converted on its own: an
 * entry that fails to bind is logged and counted, and the rest of the file is
 * still published.
 */
@Component
public class DetectionSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(DetectionSnapshotLoader.class);

    private final DetectionRecordStore store;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;
    private final String location;

    public DetectionSnapshotLoader(
            DetectionRecordStore store,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            @Value("${atlas.records.location:}") String location) {
        this.store = store;
        this.resourceLoader = resourceLoader;
        this.jsonMapper = objectMapper;
        this.yamlMapper = new YAMLMapper().registerModule(new JavaTimeModule());
        this.location = location;
        if (location != null && !location.isBlank()) {
            reload();
        } else {
            log.info("No detection record location configured, store starts empty");
        }
    }

    /**
     * Reload the configured record file.
     *
     * @return the published snapshot
     * @throws SnapshotLoadException if the file cannot be read or is not a record array
     */
    public DetectionSnapshot reload() {
        if (location == null || location.isBlank()) {
            throw new SnapshotLoadException("No detection record location configured");
        }
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return load(in, isYaml(location));
        } catch (IOException e) {
            throw new SnapshotLoadException("Failed to read detection records from " + location, e);
        }
    }

    public DetectionSnapshot load(InputStream in, boolean yaml) throws IOException {
        ObjectMapper mapper = yaml ? yamlMapper : jsonMapper;
        JsonNode root = mapper.readTree(in);
        JsonNode items = root != null && root.isObject() ? root.path("items") : root;
        if (items == null || !items.isArray()) {
            throw new SnapshotLoadException("Detection record file must contain an array of records");
        }

        List<DetectionRecord> records = new ArrayList<>(items.size());
        int rejected = 0;
        for (JsonNode item : items) {
            try {
                DetectionRecord record = jsonMapper.treeToValue(item, DetectionRecord.class);
                warnOnUnknownSource(record, item.path("source").asText(""));
                records.add(record);
            } catch (IOException | IllegalArgumentException | IllegalStateException e) {
                rejected++;
                log.warn("Skipping malformed detection record {}: {}",
                    item.path("id").asText("<no id>"), e.getMessage());
            }
        }
        return store.publish(records, rejected);
    }

    private static void warnOnUnknownSource(DetectionRecord record, String rawSource) {
        if (record.getSource() == DetectionSource.OTHER
                && !DetectionSource.OTHER.getValue().equalsIgnoreCase(rawSource.trim())) {
            log.warn("Detection record {} has unknown source '{}', counted as '{}'",
                record.getId(), rawSource, DetectionSource.OTHER.getValue());
        }
    }

    private static boolean isYaml(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yml") || lower.endsWith(".yaml");
    }
}
