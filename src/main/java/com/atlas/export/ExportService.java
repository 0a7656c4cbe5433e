package com.atlas.export;

import com.atlas.domain.DetectionRecord;
import com.atlas.domain.SearchFilters;
import com.atlas.exception.InvalidSelectionException;
import com.atlas.exception.OperationCancelledException;
import com.atlas.metrics.AnalysisMetrics;
import com.atlas.search.SearchService;
import com.atlas.store.DetectionRecordStore;
import com.atlas.store.DetectionSnapshot;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Export pipeline: resolves the selection against one snapshot and streams
 * it record by record to the caller's stream.
 *
 * The interrupt flag of the exporting thread is checked before each record;
 * an interrupted export fails with {@link OperationCancelledException}
 * instead of ending as a silently truncated document.
 */
@Service
public class ExportService {

    private static final Logger log = LoggerFactory.getLogger(ExportService.class);

    private final DetectionRecordStore store;
    private final SearchService searchService;
    private final ObjectMapper objectMapper;
    private final AnalysisMetrics metrics;

    public ExportService(DetectionRecordStore store, SearchService searchService, ObjectMapper objectMapper,
                         AnalysisMetrics metrics) {
        this.store = store;
        this.searchService = searchService;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public long export(ExportRequest request, OutputStream out) throws IOException {
        return export(request.getFormat(), request.getFilters(), request.getIds(), request.isIncludeRaw(), out);
    }

    /**
     * Select and write in one call.
     *
     * @param format output format
     * @param filters exported without pagination when no ids are given
     * @param ids explicit selection; takes precedence when non-empty, unknown ids are skipped
     * @param includeRaw whether detection logic and raw rule text are written
     * @param out target stream, left open
     * @return number of records written
     * @throws InvalidSelectionException if neither ids nor filters are given
     * @throws OperationCancelledException if the thread is interrupted mid-export
     */
    public long export(ExportFormat format, SearchFilters filters, List<String> ids, boolean includeRaw,
                       OutputStream out) throws IOException {
        return write(select(store.snapshot(), filters, ids), format, includeRaw, out);
    }

    /**
     * Resolve the selection of a request against the current snapshot.
     * Callers that stream the result asynchronously select first, so usage
     * errors surface before any response is committed.
     *
     * @throws InvalidSelectionException if neither ids nor filters are given
     */
    public List<DetectionRecord> select(ExportRequest request) {
        return select(store.snapshot(), request.getFilters(), request.getIds());
    }

    /**
     * Stream already selected records.
     *
     * This method:
     * 1. Opens the writer for the format
     * 2. Checks the thread's interrupt flag before each record
     * 3. Finishes the document and records the export size
     *
     * @param records records in output order
     * @param format output format
     * @param includeRaw whether detection logic and raw rule text are written
     * @param out target stream, left open
     * @return number of records written
     * @throws OperationCancelledException if the thread is interrupted mid-export
     */
    public long write(List<DetectionRecord> records, ExportFormat format, boolean includeRaw,
                      OutputStream out) throws IOException {
        RecordWriter writer = openWriter(format, out, includeRaw);

        long written = 0;
        for (DetectionRecord record : records) {
            if (Thread.currentThread().isInterrupted()) {
                metrics.recordExportCancelled();
                log.warn("Export cancelled after {} of {} records", written, records.size());
                throw new OperationCancelledException("export");
            }
            writer.write(record);
            written++;
        }
        writer.finish();

        metrics.recordExportCompleted(written);
        log.info("Exported {} records as {} (raw content {})", written, format.getValue(),
            includeRaw ? "included" : "omitted");
        return written;
    }

    List<DetectionRecord> select(DetectionSnapshot snapshot, SearchFilters filters, List<String> ids) {
        if (ids != null && !ids.isEmpty()) {
            List<DetectionRecord> found = searchService.findByIds(snapshot, ids);
            if (found.size() < ids.size()) {
                log.warn("Export skipped {} unknown record ids", ids.size() - found.size());
            }
            return found;
        }
        if (filters == null) {
            throw new InvalidSelectionException("Export requires either 'ids' or 'filters'");
        }
        return searchService.findMatching(snapshot, filters.unpaged());
    }

    private RecordWriter openWriter(ExportFormat format, OutputStream out, boolean includeRaw) throws IOException {
        switch (format) {
            case CSV:
                return new CsvRecordWriter(out, includeRaw);
            case JSON:
            default:
                return new JsonRecordWriter(objectMapper, out, includeRaw);
        }
    }
}
