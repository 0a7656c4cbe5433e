package com.atlas.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 */
public class ErrorResponse {

    @JsonProperty("status")
    private final int status;

    @JsonProperty("error")
    private final String error;

    @JsonProperty("detail")
    private final String detail;

    @JsonProperty("path")
    private final String path;

    @JsonProperty("timestamp")
    private final Instant timestamp;

    public ErrorResponse(int status, String error, String detail, String path) {
        this.status = status;
        this.error = error;
        this.detail = detail;
        this.path = path;
        this.timestamp = Instant.now();
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    public String getPath() {
        return path;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
