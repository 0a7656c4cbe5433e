package com.atlas.exception;

/**
 * Thrown when a long-running operation notices its thread was interrupted or
 * its deadline passed. The caller gets this instead of a partial result.
 */
public class OperationCancelledException extends RuntimeException {

    private final String operation;

    public OperationCancelledException(String operation) {
        super("Operation cancelled: " + operation);
        this.operation = operation;
    }

    public OperationCancelledException(String operation, Throwable cause) {
        super("Operation cancelled: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
