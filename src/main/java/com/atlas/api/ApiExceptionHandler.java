package com.atlas.api;

import com.atlas.exception.InvalidSelectionException;
import com.atlas.exception.OperationCancelledException;
import com.atlas.exception.RecordNotFoundException;
import com.atlas.store.SnapshotLoadException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions to HTTP status codes.
 *
 * Usage errors become 4xx responses carrying the exception message;
 * cancellation is reported as 503 so callers may retry.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(RecordNotFoundException ex, HttpServletRequest request) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidSelectionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSelection(InvalidSelectionException ex,
                                                                HttpServletRequest request) {
        log.debug("Invalid selection: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.debug("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(OperationCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(OperationCancelledException ex,
                                                         HttpServletRequest request) {
        log.warn("Operation cancelled: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), request);
    }

    @ExceptionHandler(SnapshotLoadException.class)
    public ResponseEntity<ErrorResponse> handleSnapshotLoad(SnapshotLoadException ex, HttpServletRequest request) {
        log.error("Snapshot load failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String detail,
                                                         HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(status.value(), status.getReasonPhrase(), detail,
            request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
