package com.atlas.export;

import com.atlas.domain.DetectionRecord;

import java.io.IOException;

/**
 * Streams records into one export document.
 *
 * Implementations write any document prologue on construction; nothing is
 * buffered beyond the current record.
 */
public interface RecordWriter {

    /**
     * Appends one record to the document
     *
     * @param record the record to write
     * @throws IOException if the target stream fails
     */
    void write(DetectionRecord record) throws IOException;

    /**
     * Completes the document and flushes the target stream. The stream
     * itself stays open; it belongs to the caller.
     *
     * @throws IOException if the target stream fails
     */
    void finish() throws IOException;
}
