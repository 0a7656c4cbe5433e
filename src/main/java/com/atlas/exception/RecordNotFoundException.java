package com.atlas.exception;

/**
 * Thrown when a requested record, source, tactic or technique does not exist
 * in the current snapshot.
 */
public class RecordNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public RecordNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
