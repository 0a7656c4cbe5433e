package com.atlas.api;

import com.atlas.domain.DetectionRecord;
import com.atlas.export.ExportRequest;
import com.atlas.export.ExportService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.List;

/**
 * Streams an export of the selected records as a file download.
 *
 * The selection is resolved on the request thread; only writing happens on
 * the async executor, after the response headers are committed.
 */
@RestController
@RequestMapping("/api/export")
public class ExportController {

    private final ExportService exportService;

    public ExportController(ExportService exportService) {
        this.exportService = exportService;
    }

    @PostMapping
    public ResponseEntity<StreamingResponseBody> export(@RequestBody ExportRequest request) {
        List<DetectionRecord> records = exportService.select(request);
        StreamingResponseBody body = out -> exportService.write(records, request.getFormat(),
            request.isIncludeRaw(), out);
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(request.getFormat().getContentType()))
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=" + request.getFormat().getFileName())
            .body(body);
    }
}
